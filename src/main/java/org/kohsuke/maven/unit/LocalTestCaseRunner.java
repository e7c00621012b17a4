package org.kohsuke.maven.unit;

import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * {@link TestCaseRunner} that runs tests on the current thread, one test method at a time.
 *
 * <p>
 * Test methods run in a random order, so that tests which only pass because of what an earlier
 * test left behind show up as flaky instead of hiding behind a stable order. Set a seed with
 * {@link #setSeed(Long)} to reproduce a particular order.
 */
public class LocalTestCaseRunner implements TestCaseRunner {
    private boolean enableCoverage;
    private CoverageProvider coverageProvider;
    private String projectRoot;
    private Collection<String> paths;
    private String symbolUri;
    private Long seed;
    private ProgressListener listener;
    private Log log = new SystemStreamLog();

    public LocalTestCaseRunner setEnableCoverage(boolean enableCoverage) {
        this.enableCoverage = enableCoverage;
        return this;
    }

    /**
     * Required when coverage is enabled.
     */
    public LocalTestCaseRunner setCoverageProvider(CoverageProvider coverageProvider) {
        this.coverageProvider = coverageProvider;
        return this;
    }

    /**
     * Files outside this directory are left out of coverage, and the rest are reported relative to it.
     */
    public LocalTestCaseRunner setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
        return this;
    }

    /**
     * Restricts coverage to the given project-relative paths, typically the files touched by a change.
     * Null or empty means no restriction.
     */
    public LocalTestCaseRunner setPaths(Collection<String> paths) {
        this.paths = paths;
        return this;
    }

    /**
     * Base URI of the code browser used to link results to test methods. Null for no links.
     */
    public LocalTestCaseRunner setSymbolUri(String symbolUri) {
        this.symbolUri = symbolUri;
        return this;
    }

    /**
     * Seed of the test method shuffle. Null to pick a new one for every test case.
     */
    public LocalTestCaseRunner setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    public LocalTestCaseRunner setListener(ProgressListener listener) {
        this.listener = listener;
        return this;
    }

    public LocalTestCaseRunner setLog(Log log) {
        this.log = log;
        return this;
    }

    public void willRunTestCases(List<? extends TestCase> testCases) {
        for (TestCase tc : testCases)
            tc.willRunTestCases(testCases);
    }

    public void didRunTestCases(List<? extends TestCase> testCases) {
        for (TestCase tc : testCases)
            tc.didRunTestCases(testCases);
    }

    public List<TestResult> runTestCase(TestCase testCase) {
        TestMethodTable table = TestMethodTable.of(testCase);

        CoverageSession coverage = new CoverageSession(enableCoverage, coverageProvider, projectRoot, paths);
        // fail before anything runs, not in the middle of the first test
        coverage.checkAvailable();

        TestMethodRunner runner = new TestMethodRunner(coverage,
                symbolUri == null ? null : new SymbolLinkBuilder(symbolUri));

        long s = seed != null ? seed : new Random().nextLong();
        List<String> order = table.names();
        Collections.shuffle(order, new Random(s));
        if (log.isDebugEnabled())
            log.debug(String.format("Running %d test method(s) of %s with seed %d", order.size(), testCase, s));

        List<TestResult> results = new ArrayList<TestResult>(order.size());

        try {
            Throwable setupFailure = null;
            try {
                testCase.willRunTests();
            } catch (Throwable t) {
                TestMethodRunner.rethrowIfFatal(t);
                if (!(t instanceof TestSkippedSignal))
                    log.warn("Class-level setup of " + testCase + " failed", t);
                setupFailure = t;
            }

            for (String name : order) {
                if (listener != null)
                    listener.onStart(testCase + "." + name);

                TestResult r = setupFailure == null
                        ? runner.run(testCase, name, table.get(name))
                        : runner.notRun(testCase, name, setupFailure);
                results.add(r);

                if (listener != null)
                    listener.onEnd(r);
            }
        } catch (RuntimeException e) {
            try {
                testCase.didRunTests();
            } catch (Throwable t) {
                e.addSuppressed(t);
            }
            throw e;
        }

        try {
            testCase.didRunTests();
        } catch (Throwable t) {
            throw new TestCaseTeardownException(testCase.toString(), results, t);
        }

        return results;
    }
}
