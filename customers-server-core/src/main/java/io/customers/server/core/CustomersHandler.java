package io.customers.server.core;

import io.customers.json.spi.JsonCodec;
import io.customers.json.spi.JsonCodecProvider;
import io.customers.json.spi.JsonException;
import io.customers.server.spi.BodySizeLimiter;
import io.customers.server.spi.CustomerOutcome;
import io.customers.server.spi.CustomerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Framework-neutral HTTP handler for the customers API.
 *
 * <p>Routing is delegated to {@link CustomerRoutes}; this class only turns each
 * {@link CustomerOutcome} into a {@link ServerResponse}. {@link #handle(ServerRequest)} never
 * throws.
 *
 * <pre>{@code
 * CustomersHandler handler = CustomersHandler.builder(new InMemoryCustomerStore())
 *     .maxBodySize(16 * 1024)
 *     .build();
 * }</pre>
 */
public final class CustomersHandler {
    private static final Logger log = LoggerFactory.getLogger(CustomersHandler.class);

    /** Default request body limit: 16 KiB. */
    public static final long DEFAULT_MAX_BODY_SIZE = 16 * 1024;

    static final String CONTENT_TYPE_JSON = "application/json";

    private final CustomerRoutes routes;
    private final JsonCodec codec;
    private final long maxBodySize;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param store the shared customer store (required)
     */
    public static Builder builder(CustomerStore store) {
        return new Builder(store);
    }

    public CustomersHandler(CustomerStore store) {
        this(builder(store));
    }

    private CustomersHandler(Builder builder) {
        this.codec = builder.codec != null ? builder.codec : JsonCodecProvider.loadDefault();
        this.maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : DEFAULT_MAX_BODY_SIZE;
        this.routes = new CustomerRoutes(new CustomerOperations(builder.store), codec, maxBodySize);
    }

    /**
     * Builder for {@link CustomersHandler}.
     */
    public static final class Builder {
        private final CustomerStore store;
        private JsonCodec codec;
        private long maxBodySize;

        private Builder(CustomerStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /** Sets the JSON codec. Default: the first {@link JsonCodecProvider} on the class path. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the maximum request body size in bytes. Default: {@link CustomersHandler#DEFAULT_MAX_BODY_SIZE}.
         * Pass {@link BodySizeLimiter#UNLIMITED} to let the host enforce its own limit.
         */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        public CustomersHandler build() {
            return new CustomersHandler(this);
        }
    }

    public long maxBodySize() {
        return maxBodySize;
    }

    public CustomerRoutes routes() {
        return routes;
    }

    public ServerResponse handle(ServerRequest req) {
        try {
            CustomerOutcome out = routes.dispatch(req);
            if (out.status() == CustomerOutcome.Status.BAD_REQUEST) {
                log.info("{} {} rejected: {}", req.method(), req.rawPath(), out.message().orElse("invalid body"));
            }
            return render(out);
        } catch (BodySizeLimiter.PayloadTooLargeException ptle) {
            return ServerResponse.empty(413)
                    .header("X-Error", "payload_too_large")
                    .header("X-Max-Size", Long.toString(ptle.maxBytes()));
        } catch (Exception e) {
            log.error("{} {} failed", req.method(), req.rawPath(), e);
            return ServerResponse.empty(500).header("X-Error", "internal_error");
        }
    }

    /**
     * Maps an outcome to its wire response. Encoding happens here, after the store guard has been
     * released.
     */
    ServerResponse render(CustomerOutcome out) throws JsonException {
        return switch (out.status()) {
            case LISTED -> json(200, codec.writeBytes(out.customers().orElseThrow()));
            case FOUND -> json(200, codec.writeBytes(out.customer().orElseThrow()));
            case CREATED -> ServerResponse.empty(201)
                    .header("Location", "/customers/" + out.guid().map(Urls::encodeSegment).orElse(""));
            case UPDATED -> ServerResponse.empty(200);
            case DELETED -> ServerResponse.empty(204);
            case CONFLICT -> ServerResponse.empty(409);
            case NOT_FOUND, ROUTE_NOT_FOUND -> ServerResponse.empty(404);
            case BAD_REQUEST -> ServerResponse.empty(400).header("X-Error", "invalid_body");
        };
    }

    private static ServerResponse json(int status, byte[] body) {
        return new ServerResponse(status, new ResponseBody.Json(body))
                .header("Content-Type", CONTENT_TYPE_JSON)
                .header("Cache-Control", "no-store");
    }
}
