package org.kohsuke.maven.unit;

/**
 * Receives each {@link TestResult} as soon as it is produced.
 */
public interface ProgressListener {
    /**
     * @param testName
     *      Test case class name and method name, separated by '.'.
     */
    void onStart(String testName);

    void onEnd(TestResult result);
}
