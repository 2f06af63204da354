package io.customers.server.core;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A path pattern such as {@code /customers/{guid}}.
 *
 * <p>Matching is whole-segment: {@code /customers} never matches {@code /customers/abc} and
 * {@code /customers/{guid}} never matches {@code /customers} or {@code /customers/a/b}. One
 * trailing slash on the request path is ignored. Variables capture a single non-empty segment,
 * percent-decoded as UTF-8.
 */
public final class PathTemplate {
    private final String pattern;
    private final List<String> segments;

    private PathTemplate(String pattern, List<String> segments) {
        this.pattern = pattern;
        this.segments = segments;
    }

    /**
     * @throws IllegalArgumentException if the pattern does not start with '/' or has an empty segment
     */
    public static PathTemplate parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (!pattern.startsWith("/")) throw new IllegalArgumentException("pattern must start with '/': " + pattern);
        List<String> segments = split(pattern);
        for (String s : segments) {
            if (s.isEmpty()) throw new IllegalArgumentException("empty segment in pattern: " + pattern);
            if (isVariable(s) && s.length() == 2) throw new IllegalArgumentException("unnamed variable in pattern: " + pattern);
        }
        return new PathTemplate(pattern, List.copyOf(segments));
    }

    /**
     * Matches a raw (percent-encoded) request path.
     *
     * @return the captured variables by name, or empty if the path does not match
     */
    public Optional<Map<String, String>> match(String rawPath) {
        if (rawPath == null || !rawPath.startsWith("/")) return Optional.empty();
        String path = rawPath.length() > 1 && rawPath.endsWith("/") ? rawPath.substring(0, rawPath.length() - 1) : rawPath;
        List<String> actual = split(path);
        if (actual.size() != segments.size()) return Optional.empty();

        Map<String, String> vars = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String expected = segments.get(i);
            String got = actual.get(i);
            if (isVariable(expected)) {
                if (got.isEmpty()) return Optional.empty();
                String decoded = decode(got);
                if (decoded == null) return Optional.empty();
                vars.put(expected.substring(1, expected.length() - 1), decoded);
            } else if (!expected.equals(got)) {
                return Optional.empty();
            }
        }
        return Optional.of(vars);
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return pattern;
    }

    private static boolean isVariable(String segment) {
        return segment.startsWith("{") && segment.endsWith("}");
    }

    // "/" has no segments; "/a//b" keeps the empty middle one so it cannot match
    private static List<String> split(String path) {
        List<String> out = new ArrayList<>();
        if (path.equals("/")) return out;
        int start = 1;
        while (true) {
            int slash = path.indexOf('/', start);
            if (slash < 0) {
                out.add(path.substring(start));
                return out;
            }
            out.add(path.substring(start, slash));
            start = slash + 1;
        }
    }

    private static String decode(String segment) {
        try {
            // '+' is literal in a path segment
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
