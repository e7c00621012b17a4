package org.kohsuke.maven.unit;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one test method together with its setup and teardown hooks, and turns whatever happened
 * into a single {@link TestResult}.
 */
final class TestMethodRunner {
    static final String NO_ASSERTIONS =
            "This test case made no assertions. Test cases must make at least one assertion.";

    private final CoverageSession coverage;
    private final SymbolLinkBuilder links;

    /**
     * @param links
     *      null to produce results without links.
     */
    TestMethodRunner(CoverageSession coverage, SymbolLinkBuilder links) {
        this.coverage = coverage;
        this.links = links;
    }

    /**
     * @throws TestConfigurationException
     *      if the run cannot continue at all. Nothing else escapes from here.
     */
    TestResult run(TestCase testCase, String name, TestBody body) {
        AssertionTracker tracker = testCase.getTracker();
        tracker.begin(name);
        long start = System.nanoTime();

        // phase name to what it threw, in the order the phases ran
        Map<String, Throwable> exceptions = new LinkedHashMap<String, Throwable>();
        Map<String, String> lines = Collections.emptyMap();

        try {
            testCase.willRunOneTest(name);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            exceptions.put("Setup", t);
        }

        if (exceptions.isEmpty()) {
            // a broken coverage provider still lets the teardown hook run before the run aborts
            TestConfigurationException fatal = null;
            try {
                coverage.begin();
            } catch (TestConfigurationException e) {
                fatal = e;
            }

            if (fatal == null) {
                try {
                    body.run();
                } catch (Throwable t) {
                    if (t instanceof TestConfigurationException)
                        fatal = (TestConfigurationException) t;
                    else
                        exceptions.put("Execution", t);
                }
                try {
                    lines = coverage.end();
                } catch (TestConfigurationException e) {
                    fatal = chain(fatal, e);
                }
            }

            try {
                testCase.didRunOneTest(name);
            } catch (Throwable t) {
                if (t instanceof TestConfigurationException)
                    fatal = chain(fatal, (TestConfigurationException) t);
                else
                    exceptions.put("Shutdown", t);
            }

            if (fatal != null)
                throw fatal;
        }

        TestStatus status;
        String message;
        if (exceptions.isEmpty()) {
            if (tracker.getRecordedStatus() != null) {
                // the test caught our signal and carried on, but the failed check still counts
                status = tracker.getRecordedStatus();
                message = tracker.getRecordedMessage();
            } else if (tracker.getAssertionCount() == 0) {
                status = TestStatus.FAIL;
                message = NO_ASSERTIONS;
            } else {
                status = TestStatus.PASS;
                message = String.format("%d assertion(s) passed.", tracker.getAssertionCount());
            }
        } else if (exceptions.size() == 1) {
            Throwable t = exceptions.values().iterator().next();
            if (t instanceof TestControlSignal && tracker.getRecordedStatus() != null) {
                status = tracker.getRecordedStatus();
                message = tracker.getRecordedMessage();
            } else {
                status = TestStatus.FAIL;
                message = describe(t);
            }
        } else {
            status = TestStatus.FAIL;
            message = describe(new AggregateException(
                    "Multiple exceptions were raised during test execution.", exceptions));
        }

        return newResult(testCase, name, status, System.nanoTime() - start, message, lines);
    }

    /**
     * Result for a test method that never ran because its class-level setup failed or skipped.
     */
    TestResult notRun(TestCase testCase, String name, Throwable setupFailure) {
        testCase.getTracker().begin(name);
        if (setupFailure instanceof TestSkippedSignal)
            return newResult(testCase, name, TestStatus.SKIP, 0, setupFailure.getMessage(),
                    Collections.<String, String>emptyMap());
        return newResult(testCase, name, TestStatus.ERROR, 0,
                "Class-level setup failed, so this test was not run.\n" + describe(setupFailure),
                Collections.<String, String>emptyMap());
    }

    private TestResult newResult(TestCase testCase, String name, TestStatus status, long duration,
                                 String message, Map<String, String> lines) {
        String namespace = testCase.getNamespace();
        String link = links == null ? null : links.linkTo(namespace, name);
        return new TestResult(namespace, name, status, duration, message, lines, link);
    }

    private static TestConfigurationException chain(TestConfigurationException first, TestConfigurationException next) {
        if (first == null)
            return next;
        first.addSuppressed(next);
        return first;
    }

    static void rethrowIfFatal(Throwable t) {
        if (t instanceof TestConfigurationException)
            throw (TestConfigurationException) t;
    }

    /**
     * Type, message and stack trace of a failure that did not come from an assertion.
     */
    static String describe(Throwable t) {
        StringWriter trace = new StringWriter();
        PrintWriter w = new PrintWriter(trace);
        t.printStackTrace(w);
        w.flush();
        return String.format("EXCEPTION (%s): %s\n%s", t.getClass().getName(), t.getMessage(), trace);
    }
}
