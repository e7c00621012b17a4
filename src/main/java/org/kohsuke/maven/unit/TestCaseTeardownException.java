package org.kohsuke.maven.unit;

import java.util.Collections;
import java.util.List;

/**
 * {@link TestCase#didRunTests()} failed after all the test methods ran.
 * The results of those methods are still available from here.
 */
public class TestCaseTeardownException extends RuntimeException {
    private final List<TestResult> results;

    public TestCaseTeardownException(String testCaseName, List<TestResult> results, Throwable cause) {
        super("Class-level teardown of " + testCaseName + " failed", cause);
        this.results = Collections.unmodifiableList(results);
    }

    public List<TestResult> getResults() {
        return results;
    }

    private static final long serialVersionUID = 1L;
}
