package org.kohsuke.maven.unit;

import java.util.Map;

/**
 * Line-level execution tracking. Implementations are process-wide and exclusive:
 * {@link CoverageSession} never has more than one capture running.
 *
 * <p>
 * Providers can be made available to the {@code unit:test} goal by listing them in
 * {@code META-INF/services/org.kohsuke.maven.unit.CoverageProvider} on the test classpath.
 */
public interface CoverageProvider {
    /**
     * False if the underlying instrumentation is not installed in this JVM.
     */
    boolean isAvailable();

    void start();

    /**
     * Stops tracking and returns what was executed since {@link #start()}.
     *
     * @return
     *      absolute file path to a map of 1-based line number to its state.
     *      Lines missing from the map are not executable.
     */
    Map<String, Map<Integer, LineCoverage>> stop();
}
