package org.kohsuke.maven.unit;

/**
 * Something that can be run as a test method.
 *
 * @see TestCase#registerTest(String, TestBody)
 */
public interface TestBody {
    void run() throws Throwable;
}
