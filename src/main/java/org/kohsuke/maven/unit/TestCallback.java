package org.kohsuke.maven.unit;

/**
 * Code exercised once per input by the table-driven helpers of {@link TestCase}.
 */
public interface TestCallback<T> {
    void call(T input) throws Exception;
}
