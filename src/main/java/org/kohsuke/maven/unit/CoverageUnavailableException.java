package org.kohsuke.maven.unit;

/**
 * Coverage was requested, but there is no usable {@link CoverageProvider}, or the provider broke.
 */
public class CoverageUnavailableException extends TestConfigurationException {
    public CoverageUnavailableException(String message) {
        super(message);
    }

    public CoverageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1L;
}
