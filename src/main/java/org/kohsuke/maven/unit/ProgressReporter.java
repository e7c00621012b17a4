package org.kohsuke.maven.unit;

import org.codehaus.plexus.util.StringUtils;

import java.io.Closeable;
import java.io.PrintStream;
import java.nio.charset.Charset;

/**
 * Prints a progress report on a single line that is overwritten by each test,
 * and the details of every test that did not pass.
 */
public class ProgressReporter implements ProgressListener, Closeable {
    private static final int WIDTH = 72;

    private final PrintStream report;

    public ProgressReporter(PrintStream report) {
        this.report = report;
    }

    public synchronized void onStart(String testName) {
        print("Running " + testName);
    }

    public synchronized void onEnd(TestResult result) {
        if (result.isSuccess())
            return;
        print("");
        report.println("Test " + result.status.name().toLowerCase() + ": " + result.namespace + "." + result.name);
        report.println(result.message);
        if (result.link != null)
            report.println(result.link);
    }

    public void close() {
        report.println();
    }

    private void print(String msg) {
        report.print(msg);

        // for non-ASCII chars, this is a better approximation of the line length than String.length()
        int len = msg.getBytes(Charset.defaultCharset()).length;
        if (len < WIDTH)
            report.print(StringUtils.repeat(" ", WIDTH - len));
        report.print('\r');
    }
}
