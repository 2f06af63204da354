package io.customers.server.core;

import io.customers.json.spi.JsonCodec;
import io.customers.json.spi.JsonException;
import io.customers.server.spi.BodySizeLimiter;
import io.customers.server.spi.Customer;
import io.customers.server.spi.CustomerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Route table for {@code /customers}.
 *
 * <p>Routes are tried strictly in table order and the first one whose method and path both match
 * serves the request. The table lists the {@code /customers/{guid}} routes before the
 * {@code /customers} routes; that order is part of the contract, so keep the most specific
 * patterns first when adding routes.
 *
 * <p>Bodies are decoded before any operation runs, so a malformed body never reaches the store.
 */
public final class CustomerRoutes {
    private static final Logger log = LoggerFactory.getLogger(CustomerRoutes.class);

    static final String GUID = "guid";

    private final CustomerOperations operations;
    private final JsonCodec codec;
    private final long maxBodySize;
    private final List<Route> routes;

    public CustomerRoutes(CustomerOperations operations, JsonCodec codec, long maxBodySize) {
        this.operations = Objects.requireNonNull(operations, "operations");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.maxBodySize = maxBodySize;
        this.routes = List.of(
                Route.of(HttpMethod.GET, "/customers/{guid}", (req, vars) -> operations.fetch(vars.get(GUID))),
                Route.of(HttpMethod.PUT, "/customers/{guid}", this::update),
                Route.of(HttpMethod.DELETE, "/customers/{guid}", (req, vars) -> operations.delete(vars.get(GUID))),
                Route.of(HttpMethod.POST, "/customers", this::create),
                Route.of(HttpMethod.GET, "/customers", (req, vars) -> operations.list())
        );
    }

    /**
     * The table in evaluation order.
     */
    public List<Route> routes() {
        return routes;
    }

    /**
     * Runs the first matching route.
     *
     * @return the operation's outcome, or {@code ROUTE_NOT_FOUND}
     * @throws BodySizeLimiter.PayloadTooLargeException if the body exceeds the configured limit
     * @throws IOException if the body cannot be read
     */
    public CustomerOutcome dispatch(ServerRequest request) throws IOException {
        for (Route route : routes) {
            Optional<Map<String, String>> vars = route.match(request);
            if (vars.isPresent()) {
                log.debug("{} {} -> {}", request.method(), request.rawPath(), route);
                return route.action().apply(request, vars.get());
            }
        }
        log.debug("{} {} -> no route", request.method(), request.rawPath());
        return CustomerOutcome.routeNotFound();
    }

    private CustomerOutcome create(ServerRequest request, Map<String, String> vars) throws IOException {
        Customer candidate;
        try {
            candidate = decodeBody(request);
        } catch (JsonException e) {
            return CustomerOutcome.badRequest(e.getMessage());
        }
        return operations.create(candidate);
    }

    // the path guid names the target, whatever the body says
    private CustomerOutcome update(ServerRequest request, Map<String, String> vars) throws IOException {
        Customer updated;
        try {
            updated = decodeBody(request);
        } catch (JsonException e) {
            return CustomerOutcome.badRequest(e.getMessage());
        }
        return operations.update(updated.withGuid(vars.get(GUID)));
    }

    private Customer decodeBody(ServerRequest request) throws IOException, JsonException {
        byte[] bytes = BodySizeLimiter.readAll(request.body(), maxBodySize);
        return codec.readValue(bytes, Customer.class);
    }
}
