package org.kohsuke.maven.unit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Several failures raised while running one test method, e.g. by the test body and then by its teardown hook.
 *
 * <p>
 * The causes are also attached as suppressed exceptions, so that {@link #printStackTrace()} shows all of them.
 */
public class AggregateException extends Exception {
    private final Map<String, Throwable> causes;

    /**
     * @param causes
     *      Failures keyed by the phase that raised them, in the order they happened.
     */
    public AggregateException(String message, Map<String, Throwable> causes) {
        super(message);
        this.causes = Collections.unmodifiableMap(new LinkedHashMap<String, Throwable>(causes));
        for (Throwable t : causes.values())
            addSuppressed(t);
    }

    public Map<String, Throwable> getCauses() {
        return causes;
    }

    @Override
    public String getMessage() {
        StringBuilder buf = new StringBuilder(super.getMessage());
        for (Entry<String, Throwable> e : causes.entrySet()) {
            Throwable t = e.getValue();
            buf.append("\n  - ").append(e.getKey()).append(": ").append(t.getClass().getName());
            if (t.getMessage() != null)
                buf.append(": ").append(t.getMessage());
        }
        return buf.toString();
    }

    private static final long serialVersionUID = 1L;
}
