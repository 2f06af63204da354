package io.customers.server.core;

import java.io.InputStream;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>The target is kept exactly as received (origin form, {@code /path?query}, still
 * percent-encoded). It is never parsed into a {@link java.net.URI}, so characters that
 * servers let through but {@code URI} rejects, such as '|' or '{', still reach the
 * route table.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final String target;
    private final InputStream body; // may be null

    public ServerRequest(HttpMethod method, String target, InputStream body) {
        this.method = Objects.requireNonNull(method, "method");
        this.target = Objects.requireNonNull(target, "target");
        this.body = body;
    }

    /**
     * Builds the target from a servlet-style path and query string.
     *
     * @param query the raw query, without {@code ?}; may be null
     */
    public static String target(String rawPath, String query) {
        String path = rawPath == null || rawPath.isEmpty() ? "/" : rawPath;
        return query == null ? path : path + "?" + query;
    }

    public HttpMethod method() {
        return method;
    }

    public String target() {
        return target;
    }

    /**
     * Raw (still percent-encoded) path, never empty.
     */
    public String rawPath() {
        int q = target.indexOf('?');
        String path = q < 0 ? target : target.substring(0, q);
        return path.isEmpty() ? "/" : path;
    }

    /**
     * Raw query string without the {@code ?}, or {@code null}.
     */
    public String rawQuery() {
        int q = target.indexOf('?');
        return q < 0 ? null : target.substring(q + 1);
    }

    public InputStream body() {
        return body;
    }
}
