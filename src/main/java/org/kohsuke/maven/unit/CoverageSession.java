package org.kohsuke.maven.unit;

import org.apache.commons.io.FilenameUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

/**
 * Wraps a {@link CoverageProvider} so that it captures exactly one test method at a time,
 * and turns its raw line data into the compact form kept in {@link TestResult#coverage}.
 *
 * <p>
 * When coverage is disabled, every operation is a no-op and the captured map is empty.
 */
final class CoverageSession {
    /**
     * Largest line number accepted from a provider.
     */
    static final int MAX_LINE = 1000000;

    private final boolean enabled;
    private final CoverageProvider provider;
    /**
     * Normalized with '/' separators and no trailing slash, or null.
     */
    private final String projectRoot;
    /**
     * Project-relative paths to keep, or null to keep everything.
     */
    private final Set<String> paths;

    private boolean active;

    CoverageSession(boolean enabled, CoverageProvider provider, String projectRoot, Collection<String> paths) {
        this.enabled = enabled;
        this.provider = provider;
        this.projectRoot = projectRoot == null ? null : stripTrailingSlash(FilenameUtils.separatorsToUnix(projectRoot));
        if (paths == null || paths.isEmpty()) {
            this.paths = null;
        } else {
            this.paths = new HashSet<String>();
            for (String p : paths)
                this.paths.add(FilenameUtils.separatorsToUnix(p));
        }
    }

    boolean isEnabled() {
        return enabled;
    }

    /**
     * @throws CoverageUnavailableException
     *      if coverage is enabled but cannot be collected.
     */
    void checkAvailable() {
        if (!enabled)
            return;
        if (provider == null)
            throw new CoverageUnavailableException("Code coverage is enabled, but no coverage provider is configured.");
        if (!provider.isAvailable())
            throw new CoverageUnavailableException(
                    "Code coverage is enabled, but " + provider.getClass().getName() + " is not available in this JVM.");
    }

    void begin() {
        if (!enabled)
            return;
        checkAvailable();
        if (active)
            throw new IllegalStateException("Coverage capture is already running");
        try {
            provider.start();
        } catch (RuntimeException e) {
            throw new CoverageUnavailableException(
                    "Coverage provider " + provider.getClass().getName() + " failed to start", e);
        }
        active = true;
    }

    /**
     * Stops the capture started by {@link #begin()}.
     *
     * @return
     *      Project-relative path to per-line coverage string. Never null.
     * @throws CoverageUnavailableException
     *      if the provider failed to stop or reported nonsense.
     */
    Map<String, String> end() {
        if (!enabled || !active)
            return Collections.emptyMap();
        active = false;
        Map<String, Map<Integer, LineCoverage>> report;
        try {
            report = provider.stop();
        } catch (RuntimeException e) {
            throw new CoverageUnavailableException(
                    "Coverage provider " + provider.getClass().getName() + " failed to stop", e);
        }
        return compact(report);
    }

    Map<String, String> compact(Map<String, ? extends Map<Integer, LineCoverage>> report) {
        Map<String, String> coverage = new TreeMap<String, String>();
        if (report == null)
            return coverage;

        for (Entry<String, ? extends Map<Integer, LineCoverage>> e : report.entrySet()) {
            String file = relativize(e.getKey());
            if (file == null)
                continue;
            if (paths != null && !paths.contains(file))
                continue;
            try {
                coverage.put(file, encode(e.getValue()));
            } catch (IllegalArgumentException x) {
                throw new CoverageUnavailableException("Bad coverage data for " + file, x);
            }
        }
        return coverage;
    }

    /**
     * Project-relative form of the given path, or null if it is outside the project.
     */
    private String relativize(String file) {
        file = FilenameUtils.separatorsToUnix(file);
        if (projectRoot == null)
            return file;
        // a filesystem root such as "/" already ends with the separator
        String prefix = projectRoot.endsWith("/") ? projectRoot : projectRoot + '/';
        if (!file.startsWith(prefix))
            return null;
        return file.substring(prefix.length());
    }

    /**
     * One character per line from line 1 to the last line reported. Line numbers below 1 are ignored.
     *
     * @throws IllegalArgumentException
     *      if a line number is above {@link #MAX_LINE}.
     */
    static String encode(Map<Integer, LineCoverage> lines) {
        if (lines == null || lines.isEmpty())
            return "";
        int max = 0;
        for (Integer line : lines.keySet()) {
            if (line == null)
                continue;
            if (line > MAX_LINE)
                throw new IllegalArgumentException("Line number " + line + " is above " + MAX_LINE);
            max = Math.max(max, line);
        }

        StringBuilder buf = new StringBuilder(max);
        for (int i = 1; i <= max; i++) {
            LineCoverage c = lines.get(i);
            buf.append(c == null ? LineCoverage.NOT_EXECUTABLE.code() : c.code());
        }
        return buf.toString();
    }

    private static String stripTrailingSlash(String s) {
        while (s.length() > 1 && s.endsWith("/"))
            s = s.substring(0, s.length() - 1);
        return s;
    }
}
