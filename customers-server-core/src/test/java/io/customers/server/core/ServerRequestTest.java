package io.customers.server.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServerRequestTest {

    @Test
    void splitsTargetWithoutParsingIt() {
        ServerRequest req = new ServerRequest(HttpMethod.GET, "/customers/a|b?x={y}", null);

        assertThat(req.rawPath()).isEqualTo("/customers/a|b");
        assertThat(req.rawQuery()).isEqualTo("x={y}");
    }

    @Test
    void emptyPathReadsAsRoot() {
        assertThat(new ServerRequest(HttpMethod.GET, "", null).rawPath()).isEqualTo("/");
        assertThat(new ServerRequest(HttpMethod.GET, "?q", null).rawPath()).isEqualTo("/");
        assertThat(new ServerRequest(HttpMethod.GET, "/customers", null).rawQuery()).isNull();
    }

    @Test
    void targetJoinsPathAndQuery() {
        assertThat(ServerRequest.target("/customers", null)).isEqualTo("/customers");
        assertThat(ServerRequest.target("/customers", "a=1")).isEqualTo("/customers?a=1");
        assertThat(ServerRequest.target(null, null)).isEqualTo("/");
    }
}
