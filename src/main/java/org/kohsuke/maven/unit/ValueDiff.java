package org.kohsuke.maven.unit;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diff between two rendered values.
 */
final class ValueDiff {
    /**
     * Show every line of the two values, not just the ones around a change.
     */
    private static final int CONTEXT = 0xFFFF;

    private ValueDiff() {
    }

    static String render(String expected, String actual) {
        List<String> original = Arrays.asList(expected.split("\n", -1));
        List<String> revised = Arrays.asList(actual.split("\n", -1));
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> lines = UnifiedDiffUtils.generateUnifiedDiff("expected", "actual", original, patch, CONTEXT);
        return String.join("\n", lines);
    }
}
