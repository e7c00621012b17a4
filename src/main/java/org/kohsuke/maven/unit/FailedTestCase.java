package org.kohsuke.maven.unit;

/**
 * Stands in for a test case class that could not be loaded or instantiated,
 * so that the problem is reported as a failing test instead of going unnoticed.
 */
public class FailedTestCase extends TestCase {
    private final String className;

    public FailedTestCase(String className, final Throwable failure) {
        this.className = className;
        registerTest("testInstantiation", new TestBody() {
            public void run() throws Throwable {
                throw failure;
            }
        });
    }

    @Override
    String getNamespace() {
        return className;
    }
}
