package io.customers.server.javalin;

import io.customers.json.spi.JsonCodec;
import io.customers.json.spi.JsonCodecProvider;
import io.customers.server.core.CustomerLoader;
import io.customers.server.core.CustomersHandler;
import io.customers.server.core.HttpMethod;
import io.customers.server.core.InMemoryCustomerStore;
import io.customers.server.core.ResponseBody;
import io.customers.server.core.ServerRequest;
import io.customers.server.core.ServerResponse;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves a {@link CustomersHandler} over Javalin.
 *
 * <p>Every request under {@code /} is forwarded to the handler, which owns routing; Javalin only
 * carries bytes.
 */
public final class CustomerServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CustomerServer.class);

    private final CustomerServerConfig config;
    private final CustomersHandler handler;
    private Javalin app;

    public CustomerServer(CustomerServerConfig config, CustomersHandler handler) {
        this.config = Objects.requireNonNull(config, "config");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Builds the store from {@link CustomerServerConfig#dataFile()} and wires a handler over it.
     */
    public static CustomerServer create(CustomerServerConfig config) {
        JsonCodec codec = JsonCodecProvider.loadDefault();
        InMemoryCustomerStore store = CustomerLoader.loadStore(config.dataFile(), codec);
        CustomersHandler handler = CustomersHandler.builder(store)
                .codec(codec)
                .maxBodySize(config.maxBodySize())
                .build();
        return new CustomerServer(config, handler);
    }

    public static void main(String[] args) {
        CustomerServerConfig config = CustomerServerConfig.load();
        CustomerServer server = create(config).start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "customers-shutdown"));
    }

    public synchronized CustomerServer start() {
        if (app != null) throw new IllegalStateException("already started");
        Javalin javalin = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        for (String path : List.of("/", "/*")) {
            javalin.get(path, this::handle);
            javalin.head(path, this::handle);
            javalin.post(path, this::handle);
            javalin.put(path, this::handle);
            javalin.patch(path, this::handle);
            javalin.delete(path, this::handle);
            javalin.options(path, this::handle);
        }
        // methods without a route (TRACE, CONNECT, extension methods) end in Javalin's own 404
        javalin.error(404, CustomerServer::emptyNotFound);
        javalin.start(config.host(), config.port());
        app = javalin;
        log.info("Customers API listening on http://{}:{}", config.host(), app.port());
        return this;
    }

    /**
     * Actual bound port, useful when the configured port is 0.
     */
    public synchronized int port() {
        if (app == null) throw new IllegalStateException("not started");
        return app.port();
    }

    public synchronized void stop() {
        if (app == null) return;
        app.stop();
        app = null;
        log.info("Customers API stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void handle(Context ctx) {
        ServerRequest request = new ServerRequest(
                HttpMethod.valueOf(ctx.method().name()),
                ServerRequest.target(ctx.req().getRequestURI(), ctx.req().getQueryString()),
                ctx.bodyInputStream());

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                if ("Content-Type".equalsIgnoreCase(e.getKey())) {
                    ctx.contentType(v);
                } else {
                    ctx.header(e.getKey(), v);
                }
            }
        }
        if (response.body() instanceof ResponseBody.Json json) {
            ctx.result(json.bytes());
        }
    }

    private static void emptyNotFound(Context ctx) {
        ctx.result(new byte[0]);
        ctx.header("Cache-Control", "no-store");
    }
}
