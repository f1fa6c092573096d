package ai.attackframework.tools.opensearch.utils.opensearch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OpenSearchLogFormatTest {

    @Test
    void buildRawRequest_withoutBody() {
        assertThat(OpenSearchLogFormat.buildRawRequest("http://localhost:9200", "GET", "/", ""))
                .isEqualTo("GET / HTTP/1.1\nHost: localhost:9200");
    }

    @Test
    void buildRawRequest_defaultPortOmitted_bodyAppended() {
        String raw = OpenSearchLogFormat.buildRawRequest("https://search.example.com:443", "PUT", "/products",
                "{\"settings\":{}}");

        assertThat(raw).isEqualTo("PUT /products HTTP/1.1\nHost: search.example.com\n"
                + "Content-Type: application/json\n\n{\"settings\":{}}");
    }

    @Test
    void buildRawResponse_truncatesLongBodies() {
        String raw = OpenSearchLogFormat.buildRawResponse(200, "x".repeat(5_000));

        assertThat(raw).startsWith("HTTP/1.1 200 OK\nContent-Type: application/json\n\n")
                .endsWith("...(truncated)");
        assertThat(OpenSearchLogFormat.buildRawResponse(404, "")).isEqualTo("HTTP/1.1 404");
    }

    @Test
    void indentRaw_prefixesEveryLine() {
        assertThat(OpenSearchLogFormat.indentRaw("a\nb")).isEqualTo("  a\n  b");
        assertThat(OpenSearchLogFormat.indentRaw("")).isEmpty();
        assertThat(OpenSearchLogFormat.hostHeader("not a url")).isEmpty();
    }
}
