package ai.attackframework.tools.opensearch.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ai.attackframework.tools.opensearch.errors.IndexNotFoundException;
import ai.attackframework.tools.opensearch.errors.OpenSearchOperationException;
import ai.attackframework.tools.opensearch.errors.ValidationException;
import ai.attackframework.tools.opensearch.support.FakeOpenSearchServer;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchConfig;
import ai.attackframework.tools.opensearch.utils.opensearch.OpenSearchConnector;

class IndexManagerTest {

    private static final String ACK = "{\"acknowledged\":true}";

    private FakeOpenSearchServer server;
    private OpenSearchConfig config;
    private IndexManager manager;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeOpenSearchServer();
        config = OpenSearchConfig.builder().host(server.url()).useSsl(false).build();
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T23:59:00Z"), ZoneOffset.UTC);
        manager = new IndexManager(OpenSearchConnector.getClient(config), clock);
    }

    @AfterEach
    void tearDown() {
        OpenSearchConnector.release(config);
        server.close();
    }

    private static String created(String index) {
        return "{\"acknowledged\":true,\"shards_acknowledged\":true,\"index\":\"" + index + "\"}";
    }

    @Test
    void createIndexWithSettings_appliesDefaultSettings() {
        server.respond("PUT", "/catalog", 200, created("catalog"));

        assertThat(manager.createIndexWithSettings("catalog",
                Map.of("properties", Map.of("name", Map.of("type", "text"))), null, null)).isTrue();

        String body = server.last("PUT", "/catalog").body();
        assertThat(body).contains("number_of_shards").contains("max_result_window").contains("\"mappings\"");
    }

    @Test
    void createIndexWithSettings_existingIndex_isSuccess() {
        server.respond("PUT", "/catalog", 400, FakeOpenSearchServer.errorJson(
                "resource_already_exists_exception", "index [catalog/x] already exists", 400));

        assertThat(manager.createIndexWithSettings("catalog", null, null, null)).isTrue();
    }

    @Test
    void createIndexWithSettings_otherFailures_propagate() {
        server.respond("PUT", "/catalog", 400, FakeOpenSearchServer.errorJson(
                "mapper_parsing_exception", "unknown type [txet]", 400));

        assertThatThrownBy(() -> manager.createIndexWithSettings("catalog", null, null, null))
                .isInstanceOf(OpenSearchOperationException.class)
                .hasMessageContaining("Failed to create index 'catalog'");
    }

    @Test
    void createIndexWithSettings_rejectsInvalidName() {
        assertThatThrownBy(() -> manager.createIndexWithSettings("Bad Name", null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void createTimeSeriesIndex_usesUtcDateAndAlias() {
        server.respond("PUT", "/logs-2025.03.10", 200, created("logs-2025.03.10"));
        server.respond("POST", "/_aliases", 200, ACK);

        assertThat(manager.createTimeSeriesIndex("logs", null, null)).isEqualTo("logs-2025.03.10");

        String aliasBody = server.last("POST", "/_aliases").body();
        assertThat(aliasBody).contains("\"alias\":\"logs\"").contains("\"index\":\"logs-2025.03.10\"");
    }

    @Test
    void createTimeSeriesIndex_failure_returnsEmptyName() {
        server.respond("PUT", "/logs-2025.03.10", 400, FakeOpenSearchServer.errorJson(
                "mapper_parsing_exception", "bad mapping", 400));

        assertThat(manager.createTimeSeriesIndex("logs", null, null)).isEmpty();
        assertThat(server.last("POST", "/_aliases")).isNull();
    }

    @Test
    void createAlias_sendsFilterAndRouting_andReportsFailure() {
        server.respond("POST", "/_aliases", 200, ACK);

        assertThat(manager.createAlias("red", "catalog", Map.of("term", Map.of("color", "red")), "r1")).isTrue();
        assertThat(server.last("POST", "/_aliases").body()).contains("\"routing\":\"r1\"").contains("\"color\"");

        server.close();
        assertThat(manager.createAlias("red", "catalog", null, null)).isFalse();
    }

    @Test
    void getIndexAliases_listsNames() {
        server.respond("GET", "/catalog/_alias", 200, "{\"catalog\":{\"aliases\":{\"shop\":{},\"store\":{}}}}");

        assertThat(manager.getIndexAliases("catalog")).containsExactlyInAnyOrder("shop", "store");
    }

    @Test
    void getIndexAliases_missingIndex_throws() {
        assertThatThrownBy(() -> manager.getIndexAliases("nope"))
                .isInstanceOf(IndexNotFoundException.class)
                .hasMessageContaining("Index 'nope' not found");
    }

    @Test
    void reindex_returnsCounts() {
        server.respond("POST", "/_reindex", 200, "{\"took\":10,\"timed_out\":false,\"total\":5,\"updated\":0,"
                + "\"created\":5,\"deleted\":0,\"batches\":1,\"version_conflicts\":0,\"noops\":0,"
                + "\"retries\":{\"bulk\":0,\"search\":0},\"throttled_millis\":0,\"requests_per_second\":-1.0,"
                + "\"throttled_until_millis\":0,\"failures\":[]}");

        Map<String, Object> out = manager.reindex("catalog", "catalog-v2", Map.of("term", Map.of("active", true)));

        assertThat(out).containsEntry("total", 5).containsEntry("created", 5);
        FakeOpenSearchServer.Recorded request = server.last("POST", "/_reindex");
        assertThat(request.query()).contains("wait_for_completion=true");
        assertThat(request.body()).contains("catalog-v2").contains("\"size\":1000");
    }

    @Test
    void optimizeIndex_checksShardFailures() {
        server.respond("POST", "/catalog/_forcemerge", 200, "{\"_shards\":{\"total\":2,\"successful\":2,\"failed\":0}}")
                .respond("POST", "/catalog/_forcemerge", 200, "{\"_shards\":{\"total\":2,\"successful\":1,\"failed\":1}}");

        assertThat(manager.optimizeIndex("catalog")).isTrue();
        assertThat(server.last("POST", "/catalog/_forcemerge").query()).contains("max_num_segments=1");
        assertThat(manager.optimizeIndex("catalog")).isFalse();
    }
}
