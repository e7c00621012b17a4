package org.kohsuke.maven.unit;

/**
 * The test method asked to be skipped.
 */
public final class TestSkippedSignal extends TestControlSignal {
    TestSkippedSignal(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
