package org.kohsuke.maven.unit;

/**
 * Unwinds out of the currently running test method after its outcome has been recorded.
 *
 * <p>
 * This is an {@link Error} so that {@code catch (Exception e)} in test code does not intercept it.
 * Only {@link TestMethodRunner} is supposed to catch it.
 */
public abstract class TestControlSignal extends Error {
    TestControlSignal(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
