package io.customers.server.core;

import io.customers.server.spi.CustomerOutcome;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a route table: a method, a path template and the code that serves them.
 */
public record Route(HttpMethod method, PathTemplate template, Action action) {

    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(action, "action");
    }

    public static Route of(HttpMethod method, String pattern, Action action) {
        return new Route(method, PathTemplate.parse(pattern), action);
    }

    /**
     * @return the path variables if both method and path match
     */
    Optional<Map<String, String>> match(ServerRequest request) {
        if (request.method() != method) return Optional.empty();
        return template.match(request.rawPath());
    }

    @Override
    public String toString() {
        return method + " " + template;
    }

    @FunctionalInterface
    public interface Action {
        /**
         * @throws IOException if the request body cannot be read
         */
        CustomerOutcome apply(ServerRequest request, Map<String, String> pathVariables) throws IOException;
    }
}
