package io.customers.server.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * URL helpers for building {@code Location} headers.
 */
final class Urls {
    private Urls() {}

    /**
     * Percent-encodes one path segment. The inverse of the decoding done by {@link PathTemplate}.
     */
    static String encodeSegment(String s) {
        // URLEncoder targets forms: spaces become '+', which is literal in a path
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
