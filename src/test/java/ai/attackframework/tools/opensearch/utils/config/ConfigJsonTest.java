package ai.attackframework.tools.opensearch.utils.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

class ConfigJsonTest {

    @Test
    void toJson_neverWritesSecrets() throws Exception {
        OpenSearchConfig c = OpenSearchConfig.builder()
                .host("https://search-x.us-west-2.es.amazonaws.com")
                .basicAuth("admin", "hunter2")
                .awsAccessKeyId("AKIA")
                .awsSecretAccessKey("topsecret")
                .build();

        String json = ConfigJson.toJson(c);

        assertThat(json).contains("\"username\":\"admin\"").contains("AKIA")
                .doesNotContain("hunter2").doesNotContain("topsecret");
    }

    @Test
    void toJson_keysInDeterministicOrder() throws Exception {
        OpenSearchConfig c = OpenSearchConfig.builder().host("h").header("X-A", "1").build();

        JsonNode root = ConfigJson.MAPPER.readTree(ConfigJson.toJson(c));
        List<String> keys = new ArrayList<>();
        root.fieldNames().forEachRemaining(keys::add);
        keys.remove("version");

        assertThat(keys).containsExactly("hosts", "useSsl", "verifyCerts", "timeoutSeconds", "maxRetries",
                "retryOnTimeout", "connectionPoolSize", "asyncPoolSize", "headers");
    }

    @Test
    void fromJson_restoresExportedSettings() throws Exception {
        OpenSearchConfig original = OpenSearchConfig.builder()
                .hosts(List.of("a:9200", "b:9200"))
                .useSsl(false)
                .timeoutSeconds(9)
                .maxRetries(1)
                .header("X-Tenant", "t")
                .build();

        OpenSearchConfig parsed = ConfigJson.fromJson(ConfigJson.toJson(original));

        assertThat(parsed.hosts()).isEqualTo(original.hosts());
        assertThat(parsed.useSsl()).isFalse();
        assertThat(parsed.timeoutSeconds()).isEqualTo(9);
        assertThat(parsed.maxRetries()).isEqualTo(1);
        assertThat(parsed.headers()).containsEntry("X-Tenant", "t");
    }

    @Test
    void fromJson_missingFieldsTakeDefaults() throws Exception {
        OpenSearchConfig c = ConfigJson.fromJson("{\"hosts\":[\"h\"]}");

        assertThat(c.useSsl()).isTrue();
        assertThat(c.maxRetries()).isEqualTo(OpenSearchDefaults.MAX_RETRIES);
    }

    @Test
    void parse_invalid_json_throwsIOException() {
        assertThatThrownBy(() -> ConfigJson.fromJson("{")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> ConfigJson.fromJson("[1,2]")).isInstanceOf(IOException.class);
    }

    @Test
    void fromFile_readsUtf8(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("opensearch.json");
        Files.writeString(file, "{\"hosts\":[\"file-host:9200\"],\"useSsl\":false}", StandardCharsets.UTF_8);

        assertThat(ConfigJson.fromFile(file).hosts()).containsExactly("http://file-host:9200");
    }
}
