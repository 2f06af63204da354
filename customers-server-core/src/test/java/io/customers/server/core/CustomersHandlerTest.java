package io.customers.server.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.customers.json.jackson.JacksonJsonCodec;
import io.customers.server.spi.CustomerStore;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static io.customers.server.core.CustomerRoutesTest.request;
import static io.customers.server.core.InMemoryCustomerStoreTest.customer;
import static org.assertj.core.api.Assertions.assertThat;

class CustomersHandlerTest {

    private static final String G1 = "{\"guid\":\"g1\",\"first_name\":\"A\",\"last_name\":\"B\","
            + "\"email\":\"a@b.com\",\"address\":\"X\"}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemoryCustomerStore store = new InMemoryCustomerStore();
    private final CustomersHandler handler = CustomersHandler.builder(store)
            .codec(new JacksonJsonCodec())
            .build();

    @Test
    void createFetchUpdateDeleteRoundTrip() throws Exception {
        ServerResponse created = handler.handle(request(HttpMethod.POST, "/customers", G1));
        assertThat(created.status()).isEqualTo(201);
        assertThat(created.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(created.firstHeader("Location")).isEqualTo("/customers/g1");

        ServerResponse fetched = handler.handle(request(HttpMethod.GET, "/customers/g1", null));
        assertThat(fetched.status()).isEqualTo(200);
        assertThat(fetched.firstHeader("Content-Type")).isEqualTo("application/json");
        assertThat(bodyJson(fetched)).isEqualTo(mapper.readTree(G1));

        ServerResponse updated = handler.handle(request(HttpMethod.PUT, "/customers/g1", G1.replace("\"B\"", "\"C\"")));
        assertThat(updated.status()).isEqualTo(200);
        assertThat(updated.body()).isInstanceOf(ResponseBody.Empty.class);

        ServerResponse refetched = handler.handle(request(HttpMethod.GET, "/customers/g1", null));
        assertThat(bodyJson(refetched).get("last_name").asText()).isEqualTo("C");

        ServerResponse deleted = handler.handle(request(HttpMethod.DELETE, "/customers/g1", null));
        assertThat(deleted.status()).isEqualTo(204);

        ServerResponse gone = handler.handle(request(HttpMethod.GET, "/customers/g1", null));
        assertThat(gone.status()).isEqualTo(404);
        assertThat(gone.body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void listRendersJsonArrayInInsertionOrder() throws Exception {
        handler.handle(request(HttpMethod.POST, "/customers", CustomerRoutesTest.json(customer("b"))));
        handler.handle(request(HttpMethod.POST, "/customers", CustomerRoutesTest.json(customer("a"))));

        ServerResponse listed = handler.handle(request(HttpMethod.GET, "/customers", null));

        assertThat(listed.status()).isEqualTo(200);
        JsonNode array = bodyJson(listed);
        assertThat(array.isArray()).isTrue();
        assertThat(array.get(0).get("guid").asText()).isEqualTo("b");
        assertThat(array.get(1).get("first_name").asText()).isEqualTo("First a");
    }

    @Test
    void emptyListRendersEmptyArray() throws Exception {
        ServerResponse listed = handler.handle(request(HttpMethod.GET, "/customers", null));

        assertThat(listed.status()).isEqualTo(200);
        assertThat(bodyJson(listed).isArray()).isTrue();
        assertThat(bodyJson(listed)).isEmpty();
    }

    @Test
    void duplicateCreateIsConflict() {
        handler.handle(request(HttpMethod.POST, "/customers", G1));

        ServerResponse again = handler.handle(request(HttpMethod.POST, "/customers", G1));

        assertThat(again.status()).isEqualTo(409);
        assertThat(again.body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void malformedBodyIsBadRequest() {
        ServerResponse resp = handler.handle(request(HttpMethod.POST, "/customers", "{not json"));

        assertThat(resp.status()).isEqualTo(400);
        assertThat(resp.firstHeader("X-Error")).isEqualTo("invalid_body");
    }

    @Test
    void rejectedBodyReasonIsLogged() {
        Logger logger = (Logger) LoggerFactory.getLogger(CustomersHandler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            handler.handle(request(HttpMethod.POST, "/customers", "{\"guid\":\"g1\"}"));
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage()).startsWith("POST /customers rejected: ").contains("missing field");
        });
    }

    @Test
    void updateAndDeleteOfMissingGuidAreNotFound() {
        assertThat(handler.handle(request(HttpMethod.PUT, "/customers/g1", G1)).status()).isEqualTo(404);
        assertThat(handler.handle(request(HttpMethod.DELETE, "/customers/g1", null)).status()).isEqualTo(404);
    }

    @Test
    void unknownRouteIs404WithoutBody() {
        ServerResponse resp = handler.handle(request(HttpMethod.GET, "/", null));

        assertThat(resp.status()).isEqualTo(404);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(handler.handle(request(HttpMethod.OPTIONS, "/customers", null)).status()).isEqualTo(404);
    }

    @Test
    void oversizedBodyIsRejectedBeforeTouchingStore() {
        CustomersHandler small = CustomersHandler.builder(store)
                .codec(new JacksonJsonCodec())
                .maxBodySize(16)
                .build();

        ServerResponse resp = small.handle(request(HttpMethod.POST, "/customers", G1));

        assertThat(resp.status()).isEqualTo(413);
        assertThat(resp.firstHeader("X-Error")).isEqualTo("payload_too_large");
        assertThat(resp.firstHeader("X-Max-Size")).isEqualTo("16");
        try (CustomerStore.Handle handle = store.acquire()) {
            assertThat(handle.customers()).isEmpty();
        }
    }

    @Test
    void defaultBodyLimitIsSixteenKib() {
        assertThat(handler.maxBodySize()).isEqualTo(16 * 1024);
    }

    @Test
    void unexpectedFailureIs500() {
        CustomerStore broken = () -> {
            throw new IllegalStateException("store unavailable");
        };
        CustomersHandler failing = CustomersHandler.builder(broken).codec(new JacksonJsonCodec()).build();

        ServerResponse resp = failing.handle(request(HttpMethod.GET, "/customers", null));

        assertThat(resp.status()).isEqualTo(500);
        assertThat(resp.firstHeader("X-Error")).isEqualTo("internal_error");
    }

    @Test
    void everyResponseIsMarkedUncacheable() {
        assertThat(handler.handle(request(HttpMethod.GET, "/customers", null)).firstHeader("Cache-Control"))
                .isEqualTo("no-store");
        assertThat(handler.handle(request(HttpMethod.GET, "/nope", null)).firstHeader("Cache-Control"))
                .isEqualTo("no-store");
    }

    @Test
    void locationHeaderEncodesGuid() {
        ServerResponse created = handler.handle(request(HttpMethod.POST, "/customers",
                G1.replace("\"g1\"", "\"a b\"")));

        assertThat(created.status()).isEqualTo(201);
        assertThat(created.firstHeader("Location")).isEqualTo("/customers/a%20b");
        assertThat(handler.handle(request(HttpMethod.GET, "/customers/a%20b", null)).status()).isEqualTo(200);
    }

    private JsonNode bodyJson(ServerResponse resp) throws Exception {
        assertThat(resp.body()).isInstanceOf(ResponseBody.Json.class);
        return mapper.readTree(((ResponseBody.Json) resp.body()).bytes());
    }
}
