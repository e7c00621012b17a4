package org.kohsuke.maven.unit;

import java.util.Objects;

/**
 * Assertion bookkeeping for the test method that is currently running on a {@link TestCase}.
 *
 * <p>
 * A failing check records its outcome here first and then throws a {@link TestControlSignal},
 * so by the time {@link TestMethodRunner} sees the signal, the result is already decided.
 */
final class AssertionTracker {
    private String runningTest;
    private int assertions;

    /**
     * Outcome recorded by a failed or skipped check, or null while every check passed.
     */
    private TestStatus recordedStatus;
    private String recordedMessage;

    /**
     * Called before each test method.
     */
    void begin(String testName) {
        runningTest = testName;
        assertions = 0;
        recordedStatus = null;
        recordedMessage = null;
    }

    String getRunningTest() {
        return runningTest;
    }

    int getAssertionCount() {
        return assertions;
    }

    TestStatus getRecordedStatus() {
        return recordedStatus;
    }

    String getRecordedMessage() {
        return recordedMessage;
    }

    void assertTrue(Object value, String message) {
        if (Boolean.TRUE.equals(value)) {
            assertions++;
            return;
        }
        throw failWithExpectedValue("true", value, message);
    }

    void assertFalse(Object value, String message) {
        if (Boolean.FALSE.equals(value)) {
            assertions++;
            return;
        }
        throw failWithExpectedValue("false", value, message);
    }

    void assertEqual(Object expected, Object actual, String message) {
        if (strictlyEqual(expected, actual)) {
            assertions++;
            return;
        }

        String expect = ReadableSerializer.printableValue(expected);
        String result = ReadableSerializer.printableValue(actual);
        CallerInfo caller = CallerInfo.find();

        StringBuilder output = new StringBuilder();
        if (message != null)
            output.append(String.format("Assertion failed, expected values to be equal (at %s): %s", caller, message));
        else
            output.append(String.format("Assertion failed, expected values to be equal (at %s).", caller));
        output.append('\n');

        if (expect.indexOf('\n') < 0 && result.indexOf('\n') < 0) {
            output.append("Expected: ").append(expect).append('\n');
            output.append("  Actual: ").append(result);
        } else {
            output.append("Expected vs Actual Output Diff\n");
            output.append(ValueDiff.render(expect, result));
        }

        // e.g. an ArrayList against a LinkedList with the same elements
        if (expect.equals(result))
            output.append(String.format("\nBoth values render the same, but expected a %s and got a %s.",
                    typeName(expected), typeName(actual)));

        throw terminate(output.toString());
    }

    /**
     * Records a failure and returns the signal that the caller must throw.
     */
    TestTerminatedSignal terminate(String message) {
        record(TestStatus.FAIL, message);
        return new TestTerminatedSignal(message);
    }

    TestSkippedSignal skip(String message) {
        record(TestStatus.SKIP, message);
        return new TestSkippedSignal(message);
    }

    private void record(TestStatus status, String message) {
        recordedStatus = status;
        recordedMessage = message;
    }

    private TestTerminatedSignal failWithExpectedValue(String expectDescription, Object actual, String message) {
        CallerInfo caller = CallerInfo.find();
        String description;
        if (message != null)
            description = String.format("Assertion failed, expected '%s' (at %s): %s", expectDescription, caller, message);
        else
            description = String.format("Assertion failed, expected '%s' (at %s).", expectDescription, caller);

        return terminate(description + "\n\nACTUAL VALUE\n" + ReadableSerializer.printableValue(actual));
    }

    /**
     * Same runtime type and same value. Arrays are compared by content.
     */
    static boolean strictlyEqual(Object expected, Object actual) {
        if (expected == null || actual == null)
            return expected == actual;
        return expected.getClass() == actual.getClass() && Objects.deepEquals(expected, actual);
    }

    private static String typeName(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
