package org.kohsuke.maven.unit;

/**
 * Execution state of a single source line, as reported by a {@link CoverageProvider}.
 */
public enum LineCoverage {
    COVERED('C'),
    NOT_COVERED('U'),
    NOT_EXECUTABLE('N');

    private final char code;

    LineCoverage(char code) {
        this.code = code;
    }

    /**
     * One-letter code used in the compact per-file coverage string.
     */
    public char code() {
        return code;
    }
}
