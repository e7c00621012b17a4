package org.kohsuke.maven.unit;

/**
 * A test case declares its tests incorrectly, for example a table-driven test whose inputs and
 * expectations do not line up, or an explicitly registered test without the {@code test} prefix.
 */
public class MalformedTestDeclarationException extends TestConfigurationException {
    public MalformedTestDeclarationException(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
