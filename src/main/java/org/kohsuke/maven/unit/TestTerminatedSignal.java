package org.kohsuke.maven.unit;

/**
 * An assertion failed. The rest of the test method is skipped; the next method runs normally.
 */
public final class TestTerminatedSignal extends TestControlSignal {
    TestTerminatedSignal(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
