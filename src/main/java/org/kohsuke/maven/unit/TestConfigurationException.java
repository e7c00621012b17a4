package org.kohsuke.maven.unit;

/**
 * A precondition of the run is violated. Unlike a test failure, this is never turned into a
 * {@link TestResult}; it aborts the whole run.
 */
public class TestConfigurationException extends RuntimeException {
    public TestConfigurationException(String message) {
        super(message);
    }

    public TestConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1L;
}
