package org.kohsuke.maven.unit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Base class of unit test cases.
 *
 * <p>
 * Every public, zero-argument instance method whose name starts with {@code test} is a test method,
 * and so is every body registered through {@link #registerTest(String, TestBody)}. Test methods run
 * in random order, each one must make at least one assertion, and the first failing assertion ends
 * the method.
 *
 * <p>
 * A test case is instantiated once, run once by a {@link TestCaseRunner}, and then discarded.
 * Subclasses need a public no-argument constructor to be run by the {@code unit:test} goal.
 */
public abstract class TestCase {
    private final AssertionTracker tracker = new AssertionTracker();

    /**
     * Bodies registered explicitly, in registration order.
     */
    private final Map<String, TestBody> registered = new LinkedHashMap<String, TestBody>();

/* -- Making test assertions -- */

    /**
     * Asserts that a value is {@code Boolean.FALSE}. Any other value, including null, fails.
     */
    protected final void assertFalse(Object result) {
        tracker.assertFalse(result, null);
    }

    /**
     * @param message
     *      What the value represents, and what a discrepancy means.
     */
    protected final void assertFalse(Object result, String message) {
        tracker.assertFalse(result, message);
    }

    /**
     * Asserts that a value is {@code Boolean.TRUE}. Any other value, including null, fails.
     */
    protected final void assertTrue(Object result) {
        tracker.assertTrue(result, null);
    }

    protected final void assertTrue(Object result, String message) {
        tracker.assertTrue(result, message);
    }

    /**
     * Asserts that two values are strictly equal: both null, or of the same runtime class and equal.
     * Arrays are compared by content. There is no coercion, so {@code 1} is not equal to {@code 1L}
     * or {@code "1"}.
     *
     * <p>
     * If either value renders on multiple lines, the failure message contains a diff of the two.
     */
    protected final void assertEqual(Object expect, Object result) {
        tracker.assertEqual(expect, result, null);
    }

    protected final void assertEqual(Object expect, Object result, String message) {
        tracker.assertEqual(expect, result, message);
    }

    /**
     * Fails the test unconditionally.
     */
    protected final void assertFailure(String message) {
        throw tracker.terminate(message);
    }

    /**
     * Ends this test, marking it as skipped rather than failed.
     */
    protected final void assertSkipped(String message) {
        throw tracker.skip(message);
    }

/* -- Exception handling -- */

    /**
     * Asserts that the given code throws an instance of the given exception class.
     */
    protected final void assertException(Class<? extends Exception> expected, final TestBody body) throws Exception {
        Map<String, Object> inputs = new LinkedHashMap<String, Object>();
        inputs.put("assertException", null);
        List<Boolean> expect = new ArrayList<Boolean>();
        expect.add(Boolean.FALSE);

        tryTestCases(inputs, expect, new TestCallback<Object>() {
            public void call(Object input) throws Exception {
                try {
                    body.run();
                } catch (Exception e) {
                    throw e;
                } catch (Error e) {
                    throw e;
                } catch (Throwable t) {
                    throw new Exception(t);
                }
            }
        }, expected);
    }

    /**
     * Runs a callback over a table of labelled inputs and checks which ones throw.
     *
     * @param inputs
     *      Test case labels to inputs.
     * @param expect
     *      One entry per input: true if the callback should complete normally for that input,
     *      false if it should throw {@code exceptionClass}.
     * @param exceptionClass
     *      Exceptions of this type count as "threw". Anything else propagates.
     * @throws MalformedTestDeclarationException
     *      if {@code inputs} and {@code expect} have different sizes. Nothing is run in that case.
     */
    protected final <T> void tryTestCases(Map<String, ? extends T> inputs, List<Boolean> expect,
                                          TestCallback<T> callback,
                                          Class<? extends Exception> exceptionClass) throws Exception {
        List<String> labels = new ArrayList<String>(inputs.size());
        List<T> values = new ArrayList<T>(inputs.size());
        for (Entry<String, ? extends T> e : inputs.entrySet()) {
            labels.add(e.getKey());
            values.add(e.getValue());
        }
        runTestCases(labels, values, expect, callback, exceptionClass);
    }

    private <T> void runTestCases(List<String> labels, List<T> inputs, List<Boolean> expect,
                                  TestCallback<T> callback,
                                  Class<? extends Exception> exceptionClass) throws Exception {
        if (inputs.size() != expect.size())
            throw new MalformedTestDeclarationException(String.format(
                    "Input and expectations must have the same number of values (%d inputs, %d expectations).",
                    inputs.size(), expect.size()));

        for (int i = 0; i < inputs.size(); i++) {
            String label = labels.get(i);
            boolean expected = expect.get(i);

            Exception caught = null;
            try {
                callback.call(inputs.get(i));
            } catch (Exception ex) {
                if (!exceptionClass.isInstance(ex))
                    throw ex;
                caught = ex;
            }

            boolean actual = caught == null;
            String message;
            if (expected == actual) {
                if (expected)
                    message = String.format("Test case '%s' did not throw, as expected.", label);
                else
                    message = String.format("Test case '%s' threw, as expected.", label);
            } else {
                if (expected)
                    message = String.format(
                            "Test case '%s' was expected to succeed, but it raised an exception of class %s with message: %s",
                            label, caught.getClass().getName(), caught.getMessage());
                else
                    message = String.format(
                            "Test case '%s' was expected to raise an exception, but it did not throw anything.",
                            label);
            }

            assertEqual(expected, actual, message);
        }
    }

    protected final <T> void tryTestCases(Map<String, ? extends T> inputs, List<Boolean> expect,
                                          TestCallback<T> callback) throws Exception {
        tryTestCases(inputs, expect, callback, Exception.class);
    }

    /**
     * {@link #tryTestCases(Map, List, TestCallback, Class)} for inputs that can serve as their own labels.
     * Distinct inputs that print the same, such as {@code 1} and {@code "1"}, are still run separately.
     *
     * @param map
     *      Input to whether the callback should complete normally for it.
     */
    protected final <T> void tryTestCaseMap(Map<T, Boolean> map, TestCallback<T> callback,
                                            Class<? extends Exception> exceptionClass) throws Exception {
        List<String> labels = new ArrayList<String>(map.size());
        List<T> inputs = new ArrayList<T>(map.size());
        List<Boolean> expect = new ArrayList<Boolean>(map.size());
        for (Entry<T, Boolean> e : map.entrySet()) {
            labels.add(String.valueOf(e.getKey()));
            inputs.add(e.getKey());
            expect.add(e.getValue());
        }
        runTestCases(labels, inputs, expect, callback, exceptionClass);
    }

    protected final <T> void tryTestCaseMap(Map<T, Boolean> map, TestCallback<T> callback) throws Exception {
        tryTestCaseMap(map, callback, Exception.class);
    }

/* -- Hooks for setup and teardown -- */

    /**
     * Invoked once, before any test method of this class runs.
     */
    protected void willRunTests() throws Exception {
    }

    /**
     * Invoked once, after all the test methods of this class ran, whether they passed or not.
     */
    protected void didRunTests() throws Exception {
    }

    /**
     * Invoked before each test method.
     */
    protected void willRunOneTest(String testMethodName) throws Exception {
    }

    /**
     * Invoked after each test method, even if it failed.
     */
    protected void didRunOneTest(String testMethodName) throws Exception {
    }

    /**
     * Invoked once before any of the given test cases run.
     *
     * @param testCases
     *      All the test cases of this run, including this one.
     */
    public void willRunTestCases(List<? extends TestCase> testCases) {
    }

    /**
     * Invoked once after all the given test cases ran.
     */
    public void didRunTestCases(List<? extends TestCase> testCases) {
    }

/* -- Internals -- */

    /**
     * Adds a test method that is not a method of this class, e.g. one generated from a table.
     * Meant to be called from the constructor.
     *
     * @param name
     *      Must start with {@code test}.
     */
    protected final void registerTest(String name, TestBody body) {
        if (!name.startsWith(TestMethodTable.PREFIX))
            throw new MalformedTestDeclarationException(
                    "Test method names must start with '" + TestMethodTable.PREFIX + "': " + name);
        if (registered.put(name, body) != null)
            throw new MalformedTestDeclarationException("Test method registered twice: " + name);
    }

    final Map<String, TestBody> getRegisteredTests() {
        return registered;
    }

    final AssertionTracker getTracker() {
        return tracker;
    }

    /**
     * Name of the test method currently running, or the one that ran last.
     */
    public final String getRunningTest() {
        return tracker.getRunningTest();
    }

    /**
     * Namespace of the results of this test case.
     */
    String getNamespace() {
        return getClass().getName();
    }

    @Override
    public String toString() {
        return getNamespace();
    }
}
