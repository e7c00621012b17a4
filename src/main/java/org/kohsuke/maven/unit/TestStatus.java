package org.kohsuke.maven.unit;

/**
 * Outcome of a single test method.
 */
public enum TestStatus {
    PASS,
    FAIL,
    SKIP,
    /**
     * The method could not be run at all, because the class-level setup of its test case failed.
     */
    ERROR
}
