package org.kohsuke.maven.unit;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one test method. Immutable.
 */
public final class TestResult implements Serializable {
    /**
     * Fully qualified name of the test case class.
     */
    public final String namespace;
    /**
     * Test method name.
     */
    public final String name;
    public final TestStatus status;
    /**
     * Wall clock time spent on the test method, including its setup and teardown hooks.
     */
    public final long durationNanos;
    /**
     * Human readable details, such as the assertion count or the failure description.
     */
    public final String message;
    /**
     * Project-relative file path to its per-line coverage string. Empty when coverage is off.
     *
     * @see LineCoverage#code()
     */
    public final Map<String, String> coverage;
    /**
     * Where to browse the test method, or null.
     */
    public final String link;

    public TestResult(String namespace, String name, TestStatus status, long durationNanos,
                      String message, Map<String, String> coverage, String link) {
        this.namespace = namespace;
        this.name = name;
        this.status = status;
        this.durationNanos = durationNanos;
        this.message = message;
        this.coverage = coverage.isEmpty()
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, String>(coverage));
        this.link = link;
    }

    public boolean isSuccess() {
        return status == TestStatus.PASS;
    }

    /**
     * Duration in seconds.
     */
    public double getDuration() {
        return durationNanos / 1e9;
    }

    @Override
    public String toString() {
        return namespace + "." + name + " [" + status + "]";
    }

    private static final long serialVersionUID = 1L;
}
