package ai.attackframework.tools.opensearch.utils.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.opensearch.utils.Version;

/**
 * JSON marshaling for config import/export.
 * Produces compact JSON with deterministic field order. Secrets are never written.
 */
public final class ConfigJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false);

    private ConfigJson() { }

    /** Dedicated runtime exception for config JSON errors. */
    public static final class ConfigJsonException extends RuntimeException {
        public ConfigJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /* ======================== BUILD ======================== */

    public static String toJson(OpenSearchConfig config) {
        ObjectNode root = MAPPER.createObjectNode();
        Version.find().ifPresent(v -> root.put("version", v));

        ArrayNode hosts = root.putArray("hosts");
        config.hosts().forEach(hosts::add);
        if (config.username() != null) {
            root.put("username", config.username());
        }
        root.put("useSsl", config.useSsl());
        root.put("verifyCerts", config.verifyCerts());
        root.put("timeoutSeconds", config.timeoutSeconds());
        root.put("maxRetries", config.maxRetries());
        root.put("retryOnTimeout", config.retryOnTimeout());
        root.put("connectionPoolSize", config.connectionPoolSize());
        root.put("asyncPoolSize", config.asyncPoolSize());

        if (config.isAws()) {
            ObjectNode aws = root.putObject("aws");
            aws.put("region", config.awsRegion());
            aws.put("service", config.awsService());
            if (config.awsAccessKeyId() != null) {
                aws.put("accessKeyId", config.awsAccessKeyId());
            }
        }
        if (!config.headers().isEmpty()) {
            ObjectNode headers = root.putObject("headers");
            config.headers().forEach(headers::put);
        }

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ConfigJsonException("JSON serialization error", e);
        }
    }

    /* ======================== PARSE ======================== */

    /**
     * Parses config JSON. Missing fields take their defaults.
     *
     * @throws IOException on malformed JSON
     */
    public static OpenSearchConfig fromJson(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Config JSON must be an object");
        }
        OpenSearchConfig.Builder b = OpenSearchConfig.builder();

        List<String> hosts = new ArrayList<>();
        JsonNode hostsNode = root.path("hosts");
        if (hostsNode.isArray()) {
            for (JsonNode h : hostsNode) {
                hosts.add(h.asText());
            }
        }
        b.hosts(hosts);

        if (root.has("useSsl")) b.useSsl(root.get("useSsl").asBoolean(true));
        if (root.has("verifyCerts")) b.verifyCerts(root.get("verifyCerts").asBoolean(true));
        if (root.has("timeoutSeconds")) b.timeoutSeconds(root.get("timeoutSeconds").asInt(OpenSearchDefaults.TIMEOUT_SECONDS));
        if (root.has("maxRetries")) b.maxRetries(root.get("maxRetries").asInt(OpenSearchDefaults.MAX_RETRIES));
        if (root.has("retryOnTimeout")) b.retryOnTimeout(root.get("retryOnTimeout").asBoolean(true));
        if (root.has("connectionPoolSize")) b.connectionPoolSize(root.get("connectionPoolSize").asInt(OpenSearchDefaults.POOL_SIZE));
        if (root.has("asyncPoolSize")) b.asyncPoolSize(root.get("asyncPoolSize").asInt(OpenSearchDefaults.ASYNC_POOL_SIZE));

        JsonNode aws = root.path("aws");
        if (aws.isObject()) {
            b.awsRegion(textOrNull(aws, "region"));
            b.awsAccessKeyId(textOrNull(aws, "accessKeyId"));
            String service = textOrNull(aws, "service");
            if (service != null) {
                b.awsService(service);
            }
        }

        JsonNode headers = root.path("headers");
        if (headers.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = headers.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                b.header(e.getKey(), e.getValue().asText());
            }
        }
        return b.build();
    }

    public static OpenSearchConfig fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
