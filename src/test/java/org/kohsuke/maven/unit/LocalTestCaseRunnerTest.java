package org.kohsuke.maven.unit;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class LocalTestCaseRunnerTest {
    public static class Everything extends TestCase {
        public void testPass() {
            assertTrue(true);
            assertEqual(2, 1 + 1);
        }

        public void testAssertionFailure() {
            assertEqual("expected", "actual");
            throw new AssertionError("never reached");
        }

        public void testException() {
            throw new IllegalStateException("boom");
        }

        public void testSkip() {
            assertSkipped("not here");
        }

        public void testNoAssertions() {
        }
    }

    public static class SkipAndPass extends TestCase {
        public void testSkip() {
            assertSkipped("skipped on purpose");
            assertTrue(false);
        }

        public void testPass() {
            assertTrue(true);
        }
    }

    public static class BodyAndTeardownFail extends TestCase {
        public void testBroken() {
            throw new RuntimeException("A");
        }

        @Override
        protected void didRunOneTest(String name) {
            throw new IllegalStateException("B");
        }
    }

    public static class AssertionAndTeardownFail extends TestCase {
        public void testBroken() {
            assertFailure("A");
        }

        @Override
        protected void didRunOneTest(String name) {
            throw new IllegalStateException("B");
        }
    }

    public static class OnlyTeardownFails extends TestCase {
        public void testFine() {
            assertTrue(true);
        }

        @Override
        protected void didRunOneTest(String name) {
            throw new IllegalStateException("teardown broke");
        }
    }

    public static class SwallowingTest extends TestCase {
        public void testCatchesException() {
            try {
                assertFailure("still fails");
            } catch (Exception e) {
                // a control signal is not an Exception
            }
        }

        public void testCatchesThrowable() {
            try {
                assertFailure("caught but recorded");
            } catch (Throwable t) {
                assertTrue(true);
            }
        }
    }

    /**
     * Records the order of every hook call.
     */
    public static class Hooks extends TestCase {
        final List<String> events = new ArrayList<String>();

        @Override
        protected void willRunTests() {
            events.add("willRunTests");
        }

        @Override
        protected void didRunTests() {
            events.add("didRunTests");
        }

        @Override
        protected void willRunOneTest(String name) {
            events.add("willRunOneTest:" + name);
        }

        @Override
        protected void didRunOneTest(String name) {
            events.add("didRunOneTest:" + name);
        }

        @Override
        public void willRunTestCases(List<? extends TestCase> testCases) {
            events.add("willRunTestCases:" + testCases.size());
        }

        @Override
        public void didRunTestCases(List<? extends TestCase> testCases) {
            events.add("didRunTestCases:" + testCases.size());
        }

        public void testOne() {
            events.add("testOne");
            assertTrue(true);
        }

        public void testTwo() {
            events.add("testTwo");
            assertFailure("two fails");
        }
    }

    public static class FailingSetUp extends Hooks {
        @Override
        protected void willRunOneTest(String name) {
            super.willRunOneTest(name);
            throw new IllegalArgumentException("setup broke");
        }
    }

    public static class FailingClassSetUp extends Hooks {
        @Override
        protected void willRunTests() {
            super.willRunTests();
            throw new IllegalStateException("no database");
        }
    }

    public static class SkippingClassSetUp extends Hooks {
        @Override
        protected void willRunTests() {
            assertSkipped("whole class skipped");
        }
    }

    public static class FailingClassTeardown extends Hooks {
        @Override
        protected void didRunTests() {
            throw new IllegalStateException("cleanup broke");
        }
    }

    /**
     * Six independent tests, for checking the order.
     */
    public static class Many extends TestCase {
        final List<String> ran = new ArrayList<String>();

        public void test1() { ran.add("test1"); assertTrue(true); }
        public void test2() { ran.add("test2"); assertTrue(true); }
        public void test3() { ran.add("test3"); assertTrue(true); }
        public void test4() { ran.add("test4"); assertTrue(true); }
        public void test5() { ran.add("test5"); assertTrue(true); }
        public void test6() { ran.add("test6"); assertFailure("six"); }
    }

    private final LocalTestCaseRunner runner = new LocalTestCaseRunner();

    @Test
    void oneResultPerTestMethodWhateverHappens() {
        List<TestResult> results = runner.runTestCase(new Everything());

        assertThat(results).hasSize(5);
        Map<String, TestResult> byName = byName(results);
        assertThat(byName.get("testPass").status).isEqualTo(TestStatus.PASS);
        assertThat(byName.get("testPass").message).isEqualTo("2 assertion(s) passed.");
        assertThat(byName.get("testAssertionFailure").status).isEqualTo(TestStatus.FAIL);
        assertThat(byName.get("testAssertionFailure").message).contains("Expected: \"expected\"").doesNotContain("never reached");
        assertThat(byName.get("testException").status).isEqualTo(TestStatus.FAIL);
        assertThat(byName.get("testSkip").status).isEqualTo(TestStatus.SKIP);
        assertThat(byName.get("testSkip").message).isEqualTo("not here");
        assertThat(byName.get("testNoAssertions").status).isEqualTo(TestStatus.FAIL);

        for (TestResult r : results) {
            assertThat(r.namespace).isEqualTo(Everything.class.getName());
            assertThat(r.durationNanos).isGreaterThanOrEqualTo(0);
            assertThat(r.coverage).isEmpty();
            assertThat(r.link).isNull();
        }
    }

    @Test
    void testWithoutAssertionsFails() {
        TestResult r = byName(runner.runTestCase(new Everything())).get("testNoAssertions");

        assertThat(r.status).isEqualTo(TestStatus.FAIL);
        assertThat(r.message).isEqualTo(TestMethodRunner.NO_ASSERTIONS);
    }

    @Test
    void unhandledExceptionIsReportedWithTypeMessageAndTrace() {
        TestResult r = byName(runner.runTestCase(new Everything())).get("testException");

        assertThat(r.message)
                .startsWith("EXCEPTION (java.lang.IllegalStateException): boom\n")
                .contains("at " + Everything.class.getName() + ".testException");
    }

    @Test
    void skipDoesNotAffectSiblings() {
        List<TestResult> results = runner.runTestCase(new SkipAndPass());

        assertThat(results).extracting(r -> r.status).containsExactlyInAnyOrder(TestStatus.SKIP, TestStatus.PASS);
        assertThat(byName(results).get("testSkip").message).isEqualTo("skipped on purpose");
    }

    @Test
    void bodyAndTeardownFailuresAreBothReported() {
        List<TestResult> results = runner.runTestCase(new BodyAndTeardownFail());

        assertThat(results).hasSize(1);
        TestResult r = results.get(0);
        assertThat(r.status).isEqualTo(TestStatus.FAIL);
        assertThat(r.message)
                .startsWith("EXCEPTION (" + AggregateException.class.getName() + "): Multiple exceptions were raised")
                .contains("Execution: java.lang.RuntimeException: A")
                .contains("Shutdown: java.lang.IllegalStateException: B");
    }

    @Test
    void teardownFailureIsNotLostAfterAFailedAssertion() {
        TestResult r = runner.runTestCase(new AssertionAndTeardownFail()).get(0);

        assertThat(r.status).isEqualTo(TestStatus.FAIL);
        assertThat(r.message)
                .contains("Execution: " + TestTerminatedSignal.class.getName() + ": A")
                .contains("Shutdown: java.lang.IllegalStateException: B");
    }

    @Test
    void teardownFailureAloneFailsAPassingTest() {
        TestResult r = runner.runTestCase(new OnlyTeardownFails()).get(0);

        assertThat(r.status).isEqualTo(TestStatus.FAIL);
        assertThat(r.message).startsWith("EXCEPTION (java.lang.IllegalStateException): teardown broke");
    }

    @Test
    void testCodeCannotSwallowAFailedAssertion() {
        Map<String, TestResult> results = byName(runner.runTestCase(new SwallowingTest()));

        assertThat(results.get("testCatchesException").status).isEqualTo(TestStatus.FAIL);
        assertThat(results.get("testCatchesException").message).isEqualTo("still fails");
        assertThat(results.get("testCatchesThrowable").status).isEqualTo(TestStatus.FAIL);
        assertThat(results.get("testCatchesThrowable").message).isEqualTo("caught but recorded");
    }

    @Test
    void hooksWrapEveryTestMethod() {
        Hooks hooks = new Hooks();
        List<TestResult> results = runner.setSeed(7L).runTestCase(hooks);

        assertThat(hooks.events).hasSize(8);
        assertThat(hooks.events.get(0)).isEqualTo("willRunTests");
        assertThat(hooks.events.get(7)).isEqualTo("didRunTests");
        for (int i = 0; i < 2; i++) {
            String name = results.get(i).name;
            assertThat(hooks.events.subList(1 + i * 3, 4 + i * 3))
                    .containsExactly("willRunOneTest:" + name, name, "didRunOneTest:" + name);
        }
    }

    @Test
    void failingSetUpSkipsBodyAndTeardown() {
        FailingSetUp tc = new FailingSetUp();
        List<TestResult> results = runner.runTestCase(tc);

        assertThat(results).hasSize(2).allSatisfy(r -> {
            assertThat(r.status).isEqualTo(TestStatus.FAIL);
            assertThat(r.message).startsWith("EXCEPTION (java.lang.IllegalArgumentException): setup broke");
        });
        assertThat(tc.events).doesNotContain("testOne", "testTwo", "didRunOneTest:testOne", "didRunOneTest:testTwo");
        assertThat(tc.events).endsWith("didRunTests");
    }

    @Test
    void failingClassSetUpMarksEveryTestAsError() {
        FailingClassSetUp tc = new FailingClassSetUp();
        List<TestResult> results = runner.setLog(mock(Log.class)).runTestCase(tc);

        assertThat(results).hasSize(2).allSatisfy(r -> {
            assertThat(r.status).isEqualTo(TestStatus.ERROR);
            assertThat(r.message).contains("Class-level setup failed").contains("no database");
        });
        assertThat(tc.events).containsExactly("willRunTests", "didRunTests");
    }

    @Test
    void skippingClassSetUpSkipsEveryTest() {
        List<TestResult> results = runner.runTestCase(new SkippingClassSetUp());

        assertThat(results).hasSize(2).allSatisfy(r -> {
            assertThat(r.status).isEqualTo(TestStatus.SKIP);
            assertThat(r.message).isEqualTo("whole class skipped");
        });
    }

    @Test
    void failingClassTeardownKeepsTheResults() {
        FailingClassTeardown tc = new FailingClassTeardown();

        assertThatThrownBy(() -> runner.runTestCase(tc))
                .isInstanceOf(TestCaseTeardownException.class)
                .hasRootCauseMessage("cleanup broke")
                .satisfies(e -> assertThat(((TestCaseTeardownException) e).getResults()).hasSize(2));
    }

    @Test
    void listLevelHooksArePassedThrough() {
        Hooks a = new Hooks();
        Hooks b = new Hooks();
        List<Hooks> all = Arrays.asList(a, b);

        runner.willRunTestCases(all);
        runner.didRunTestCases(all);

        assertThat(a.events).containsExactly("willRunTestCases:2", "didRunTestCases:2");
        assertThat(b.events).containsExactly("willRunTestCases:2", "didRunTestCases:2");
    }

    @Test
    void resultsComeInExecutionOrder() {
        Many tc = new Many();
        List<TestResult> results = runner.runTestCase(tc);

        List<String> names = new ArrayList<String>();
        for (TestResult r : results)
            names.add(r.name);
        assertThat(names).isEqualTo(tc.ran);
    }

    @Test
    void sameSeedSameOrder() {
        Many first = new Many();
        Many second = new Many();
        runner.setSeed(42L).runTestCase(first);
        runner.setSeed(42L).runTestCase(second);

        assertThat(first.ran).isEqualTo(second.ran);
    }

    @Test
    void orderIsShuffled() {
        Set<List<String>> orders = new HashSet<List<String>>();
        for (long seed = 0; seed < 20; seed++) {
            Many tc = new Many();
            runner.setSeed(seed).runTestCase(tc);
            orders.add(tc.ran);
        }
        assertThat(orders.size()).isGreaterThan(1);
    }

    @Test
    void outcomesDoNotDependOnOrder() {
        Map<String, TestStatus> first = statuses(runner.setSeed(1L).runTestCase(new Many()));
        Map<String, TestStatus> second = statuses(runner.setSeed(2L).runTestCase(new Many()));
        Map<String, TestStatus> unseeded = statuses(runner.setSeed(null).runTestCase(new Many()));

        assertThat(first).isEqualTo(second).isEqualTo(unseeded);
        assertThat(first.get("test6")).isEqualTo(TestStatus.FAIL);
    }

    @Test
    void listenerSeesEveryResultAsItIsProduced() {
        final List<String> seen = new ArrayList<String>();
        runner.setListener(new ProgressListener() {
            public void onStart(String testName) {
                seen.add("start " + testName);
            }

            public void onEnd(TestResult result) {
                seen.add("end " + result.name);
            }
        });

        List<TestResult> results = runner.runTestCase(new SkipAndPass());

        String ns = SkipAndPass.class.getName();
        assertThat(seen).containsExactly(
                "start " + ns + "." + results.get(0).name, "end " + results.get(0).name,
                "start " + ns + "." + results.get(1).name, "end " + results.get(1).name);
    }

    @Test
    void resultsLinkToTheSymbolBrowserWhenConfigured() {
        TestResult r = runner.setSymbolUri("https://code.example.org/").runTestCase(new OnlyTeardownFails()).get(0);

        assertThat(r.link).isEqualTo("https://code.example.org/diffusion/symbol/testFine/?context="
                + OnlyTeardownFails.class.getName().replace("$", "%24") + "&jump=true&lang=java");
    }

    private static Map<String, TestResult> byName(List<TestResult> results) {
        Map<String, TestResult> map = new HashMap<String, TestResult>();
        for (TestResult r : results)
            map.put(r.name, r);
        return map;
    }

    private static Map<String, TestStatus> statuses(List<TestResult> results) {
        Map<String, TestStatus> map = new HashMap<String, TestStatus>();
        for (TestResult r : results)
            map.put(r.name, r.status);
        return map;
    }
}
