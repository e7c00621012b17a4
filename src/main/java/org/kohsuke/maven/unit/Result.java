package org.kohsuke.maven.unit;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tally of {@link TestResult}s over several test cases.
 */
public class Result implements Serializable {
    public final int totalRun;
    public final List<TestResult> failures = new ArrayList<TestResult>();
    public final List<TestResult> errors = new ArrayList<TestResult>();
    public final List<TestResult> skipped = new ArrayList<TestResult>();

    public Result(int totalRun) {
        this.totalRun = totalRun;
    }

    public Result add(Result that) {
        Result r = new Result(this.totalRun + that.totalRun);
        r.failures.addAll(this.failures);
        r.failures.addAll(that.failures);
        r.errors.addAll(this.errors);
        r.errors.addAll(that.errors);
        r.skipped.addAll(this.skipped);
        r.skipped.addAll(that.skipped);
        return r;
    }

    public static Result from(List<TestResult> results) {
        Result r = new Result(results.size());
        for (TestResult tr : results) {
            switch (tr.status) {
            case FAIL:
                r.failures.add(tr);
                break;
            case ERROR:
                r.errors.add(tr);
                break;
            case SKIP:
                r.skipped.add(tr);
                break;
            default:
                break;
            }
        }
        return r;
    }

    /**
     * Skipped tests do not count against success.
     */
    public boolean isSuccess() {
        return failures.isEmpty() && errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Tests run: %d, Failures: %d, Errors: %d, Skipped: %d",
                totalRun, failures.size(), errors.size(), skipped.size());
    }

    public static final Result ZERO = new Result(0);

    private static final long serialVersionUID = 1L;
}
