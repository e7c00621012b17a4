package org.kohsuke.maven.unit;

import java.util.List;

/**
 * Runs test cases.
 */
public interface TestCaseRunner {
    /**
     * Prepares for a run of the given test cases, by passing the list to
     * {@link TestCase#willRunTestCases(List)} of each of them.
     */
    void willRunTestCases(List<? extends TestCase> testCases);

    /**
     * Runs all the test methods of a single test case and returns their results,
     * one per test method, in the order they ran.
     *
     * @throws TestConfigurationException
     *      if the run has to be aborted.
     */
    List<TestResult> runTestCase(TestCase testCase);

    /**
     * The clean up that pairs with {@link #willRunTestCases(List)}.
     */
    void didRunTestCases(List<? extends TestCase> testCases);
}
