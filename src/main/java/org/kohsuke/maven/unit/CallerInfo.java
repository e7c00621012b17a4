package org.kohsuke.maven.unit;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Locates the test code that made a failing assertion.
 */
final class CallerInfo {
    private static final Set<String> ENGINE_CLASSES = new HashSet<String>(Arrays.asList(
            CallerInfo.class.getName(),
            AssertionTracker.class.getName(),
            TestCase.class.getName()));

    final String file;
    final int line;

    private CallerInfo(String file, int line) {
        this.file = file;
        this.line = line;
    }

    /**
     * The innermost stack frame that does not belong to the assertion machinery.
     */
    static CallerInfo find() {
        for (StackTraceElement e : new Throwable().getStackTrace()) {
            if (ENGINE_CLASSES.contains(e.getClassName()))
                continue;
            return new CallerInfo(e.getFileName() == null ? "unknown" : e.getFileName(), e.getLineNumber());
        }
        return new CallerInfo("unknown", -1);
    }

    @Override
    public String toString() {
        return file + ':' + line;
    }
}
