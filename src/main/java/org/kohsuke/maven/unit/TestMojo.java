package org.kohsuke.maven.unit;

/*
 * Copyright 2001-2005 The Apache Software Foundation.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.apache.commons.io.output.NullOutputStream;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.plugins.annotations.ResolutionScope;
import org.codehaus.plexus.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.ServiceLoader;

/**
 * Runs unit test cases.
 */
@Mojo(name = "test", defaultPhase = LifecyclePhase.TEST, requiresDependencyResolution = ResolutionScope.TEST)
public class TestMojo extends AbstractMojo
{
    /**
     * The classpath elements of the project being tested.
     */
    @Parameter(defaultValue = "${project.testClasspathElements}", required = true, readonly = true)
    protected List<String> classpathElements;

    /**
     * Fully qualified class names of the test cases to run. Picking them is up to the caller;
     * the classpath is not scanned.
     */
    @Parameter(property = "unit.testCases")
    protected List<String> testCases;

    /**
     * Set this to true to ignore a failure during testing. Its use is NOT RECOMMENDED, but quite convenient on
     * occasion.
     */
    @Parameter(property = "maven.test.failure.ignore", defaultValue = "false")
    protected boolean testFailureIgnore;

    /**
     * Set this to 'true' to skip running tests, but still compile them. Its use is NOT RECOMMENDED, but quite
     * convenient on occasion.
     */
    @Parameter(property = "skipTests", defaultValue = "false")
    protected boolean skipTests;

    /**
     * If true, the stdout/stderr from tests will not be copied to the console.
     */
    @Parameter(property = "unit.quiet", defaultValue = "true")
    protected boolean quiet;

    /**
     * Collect line coverage for every test method. Needs a {@link CoverageProvider} registered
     * as a service on the test classpath.
     */
    @Parameter(property = "unit.coverage", defaultValue = "false")
    protected boolean enableCoverage;

    /**
     * Project-relative paths to keep coverage for, typically the files touched by a change.
     * Coverage of all the files in the project is kept if empty.
     */
    @Parameter(property = "unit.paths")
    protected List<String> paths;

    /**
     * Seed of the test method order. Each run picks a new one and prints it,
     * so that an order-dependent failure can be reproduced.
     */
    @Parameter(property = "unit.seed")
    protected Long seed;

    /**
     * Base URI of a code browser to link test results to.
     */
    @Parameter(property = "unit.symbolUri")
    protected String symbolUri;

    @Parameter(defaultValue = "${project.basedir}", readonly = true)
    protected File baseDirectory;

    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skipTests) {
            getLog().info("Tests are skipped.");
            return;
        }
        if (testCases == null || testCases.isEmpty()) {
            getLog().info("No test cases to run.");
            return;
        }

        long s = seed != null ? seed : new Random().nextLong();
        getLog().info("Test method order seed: " + s + " (use -Dunit.seed=" + s + " to run in the same order)");

        PrintStream progress = System.out; // before we start messing around with stdout/stderr, this is where we send the progress report.
        PrintStream out = System.out;
        PrintStream err = System.err;

        URLClassLoader cl;
        try {
            cl = makeClassLoader();
        } catch (MalformedURLException e) {
            throw new MojoExecutionException("Failed to execute unit tests", e);
        }

        Thread t = Thread.currentThread();
        ClassLoader old = t.getContextClassLoader();
        t.setContextClassLoader(cl);

        ProgressReporter reporter = new ProgressReporter(progress);
        if (quiet)
            redirectToDevNull();

        Result r = Result.ZERO;
        long startTime = System.currentTimeMillis();
        try {
            List<TestCase> cases = buildTestCases(cl);
            TestCaseRunner runner = createTestCaseRunner(cl, s, reporter);

            runner.willRunTestCases(cases);
            try {
                for (TestCase tc : cases)
                    r = r.add(Result.from(runTestCase(runner, tc)));
            } finally {
                runner.didRunTestCases(cases);
            }
        } catch (TestConfigurationException e) {
            throw new MojoExecutionException("Failed to execute unit tests", e);
        } finally {
            System.setOut(out);
            System.setErr(err);
            t.setContextClassLoader(old);
            reporter.close();
            close(cl);
        }

        printResult(r, System.currentTimeMillis() - startTime);

        if (!r.isSuccess()) {
            if (testFailureIgnore)
                getLog().warn("There are test failures, but maven.test.failure.ignore is set.");
            else
                throw new MojoFailureException(r.toString());
        }
    }

    protected TestCaseRunner createTestCaseRunner(ClassLoader cl, long seed, ProgressListener listener) {
        return new LocalTestCaseRunner()
                .setEnableCoverage(enableCoverage)
                .setCoverageProvider(enableCoverage ? findCoverageProvider(cl) : null)
                .setProjectRoot(baseDirectory == null ? null : baseDirectory.getAbsolutePath())
                .setPaths(paths)
                .setSymbolUri(StringUtils.isEmpty(symbolUri) ? null : symbolUri)
                .setSeed(seed)
                .setListener(listener)
                .setLog(getLog());
    }

    /**
     * The first {@link CoverageProvider} registered on the test classpath, or null.
     */
    protected CoverageProvider findCoverageProvider(ClassLoader cl) {
        for (CoverageProvider p : ServiceLoader.load(CoverageProvider.class, cl))
            return p;
        return null;
    }

    /**
     * Runs one test case, turning a failed class-level teardown into an extra error.
     */
    private List<TestResult> runTestCase(TestCaseRunner runner, TestCase tc) {
        try {
            return runner.runTestCase(tc);
        } catch (TestCaseTeardownException e) {
            List<TestResult> results = new ArrayList<TestResult>(e.getResults());
            results.add(new TestResult(tc.getNamespace(), "didRunTests", TestStatus.ERROR, 0,
                    TestMethodRunner.describe(e.getCause()), Collections.<String, String>emptyMap(), null));
            return results;
        }
    }

    private List<TestCase> buildTestCases(ClassLoader cl) {
        List<TestCase> cases = new ArrayList<TestCase>();
        for (String name : testCases) {
            name = name.trim();
            if (name.length() == 0)
                continue;
            TestCase tc = buildTestCase(cl, name);
            if (tc != null)
                cases.add(tc);
        }
        return cases;
    }

    /**
     * @return
     *      null if the class is abstract, as there is nothing to run.
     */
    protected TestCase buildTestCase(ClassLoader cl, String className) {
        try {
            Class<?> c = cl.loadClass(className);
            if (!TestCase.class.isAssignableFrom(c))
                return new FailedTestCase(className, new IllegalArgumentException(
                        className + " does not extend " + TestCase.class.getName()));
            if (Modifier.isAbstract(c.getModifiers())) {
                getLog().debug("Skipping abstract test case " + className);
                return null;
            }
            return (TestCase) c.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            TestMethodRunner.rethrowIfFatal(e.getTargetException());
            return new FailedTestCase(className, e.getTargetException());
        } catch (ReflectiveOperationException e) {
            return new FailedTestCase(className, e);
        } catch (LinkageError e) {
            return new FailedTestCase(className, e);
        }
    }

    private void close(URLClassLoader cl) {
        try {
            cl.close();
        } catch (IOException e) {
            getLog().warn("Failed to close the test class loader", e);
        }
    }

    private void redirectToDevNull() {
        System.setOut(new PrintStream(NullOutputStream.INSTANCE));
        System.setErr(new PrintStream(NullOutputStream.INSTANCE));
    }

    private void printResult(Result r, long totalTime) {
        if (!r.failures.isEmpty() || !r.errors.isEmpty()) {
            getLog().error("Failed tests:");
            for (TestResult tr : r.failures)
                getLog().error("  " + tr.namespace + "." + tr.name);
            for (TestResult tr : r.errors)
                getLog().error("  " + tr.namespace + "." + tr.name + " (error)");
        }
        getLog().info(String.format("%s, Time elapsed: %.3f s", r, totalTime / 1000.0));
    }

    /**
     * Creates a classloader for loading tests.
     *
     * <p>
     * We need to be able to see the same engine classes between this code and the test code,
     * but everything else should be isolated.
     */
    protected URLClassLoader makeClassLoader() throws MalformedURLException {
        List<URL> urls = new ArrayList<URL>(classpathElements.size());
        for (String e : classpathElements)
            urls.add(new File(e).toURI().toURL());
        return new URLClassLoader(urls.toArray(new URL[urls.size()]),
                new EngineSharingClassLoader(ClassLoader.getPlatformClassLoader(), getClass().getClassLoader()));
    }
}
