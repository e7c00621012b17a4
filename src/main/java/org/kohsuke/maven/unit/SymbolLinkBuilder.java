package org.kohsuke.maven.unit;

import org.codehaus.plexus.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the link attached to each {@link TestResult}, pointing to the symbol browser
 * of a code review server.
 */
public final class SymbolLinkBuilder {
    private final String baseUri;

    /**
     * @param baseUri
     *      Root of the code browser, such as {@code https://code.example.org/}.
     */
    public SymbolLinkBuilder(String baseUri) {
        if (StringUtils.isEmpty(baseUri))
            throw new IllegalArgumentException("baseUri is required");
        this.baseUri = StringUtils.stripEnd(baseUri, "/");
    }

    public String linkTo(String className, String methodName) {
        return baseUri + "/diffusion/symbol/" + encode(methodName) + "/"
                + "?context=" + encode(className)
                + "&jump=true"
                + "&lang=java";
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
