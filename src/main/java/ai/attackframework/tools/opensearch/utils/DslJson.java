package ai.attackframework.tools.opensearch.utils;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.attackframework.tools.opensearch.errors.SearchQueryException;
import jakarta.json.Json;
import jakarta.json.stream.JsonGenerator;
import jakarta.json.stream.JsonParser;
import org.opensearch.client.json.JsonpDeserializer;
import org.opensearch.client.json.JsonpMapper;
import org.opensearch.client.json.JsonpSerializable;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch._types.ShardStatistics;
import org.opensearch.client.opensearch._types.SortOptions;
import org.opensearch.client.opensearch._types.aggregations.Aggregate;
import org.opensearch.client.opensearch._types.aggregations.Aggregation;
import org.opensearch.client.opensearch._types.mapping.TypeMapping;
import org.opensearch.client.opensearch._types.query_dsl.Query;
import org.opensearch.client.opensearch.core.SearchRequest;
import org.opensearch.client.opensearch.core.search.Highlight;
import org.opensearch.client.opensearch.core.search.Suggester;
import org.opensearch.client.opensearch._types.ScriptField;
import org.opensearch.client.opensearch.indices.Alias;
import org.opensearch.client.opensearch.indices.IndexSettings;

/**
 * Bridge between plain DSL maps and the client's typed request/response objects.
 *
 * <p>Requests: the map is written as JSON and read back through the type's
 * {@code _DESERIALIZER}. Responses: the typed object is serialized with the JSON-P mapper and
 * read into a {@code Map}.</p>
 */
public final class DslJson {

    static final JsonpMapper MAPPER = new JacksonJsonpMapper();
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private DslJson() {}

    /**
     * Full search request from a body map ({@code query}, {@code size}, {@code aggs}, {@code suggest}...).
     * The index and URL parameters are added by the caller through {@code toBuilder()}.
     */
    public static SearchRequest searchRequest(Map<String, Object> body) {
        return deserialize(body, SearchRequest._DESERIALIZER, "search");
    }

    public static Query query(Map<String, Object> dsl) {
        return deserialize(dsl, Query._DESERIALIZER, "query");
    }

    public static Map<String, Aggregation> aggregations(Map<String, Object> dsl) {
        return deserialize(dsl, JsonpDeserializer.stringMapDeserializer(Aggregation._DESERIALIZER), "aggregations");
    }

    public static Highlight highlight(Map<String, Object> dsl) {
        return deserialize(dsl, Highlight._DESERIALIZER, "highlight");
    }

    public static Suggester suggester(Map<String, Object> dsl) {
        return deserialize(dsl, Suggester._DESERIALIZER, "suggest");
    }

    public static Map<String, ScriptField> scriptFields(Map<String, Object> dsl) {
        return deserialize(dsl, JsonpDeserializer.stringMapDeserializer(ScriptField._DESERIALIZER), "script_fields");
    }

    public static IndexSettings indexSettings(Map<String, Object> dsl) {
        return deserialize(dsl, IndexSettings._DESERIALIZER, "settings");
    }

    public static TypeMapping typeMapping(Map<String, Object> dsl) {
        return deserialize(dsl, TypeMapping._DESERIALIZER, "mappings");
    }

    public static Map<String, Alias> aliases(Map<String, Object> dsl) {
        return deserialize(dsl, JsonpDeserializer.stringMapDeserializer(Alias._DESERIALIZER), "aliases");
    }

    /**
     * Converts sort entries (field names, {@code _score}, {@code _doc} or DSL maps) to typed options.
     */
    @SuppressWarnings("unchecked")
    public static List<SortOptions> sort(List<?> entries) {
        List<SortOptions> out = new ArrayList<>();
        if (entries == null) {
            return out;
        }
        for (Object entry : entries) {
            Map<String, Object> dsl;
            if (entry instanceof String field) {
                dsl = normalizeSort(field);
            } else if (entry instanceof Map<?, ?> m) {
                dsl = (Map<String, Object>) m;
            } else {
                throw new SearchQueryException("Unsupported sort entry: " + entry);
            }
            out.add(deserialize(dsl, SortOptions._DESERIALIZER, "sort"));
        }
        return out;
    }

    /** Sort entries as DSL: bare field names expand to {@code {field: {order}}}, maps pass through. */
    public static List<Object> expandSort(List<?> entries) {
        List<Object> out = new ArrayList<>();
        if (entries != null) {
            for (Object entry : entries) {
                out.add(entry instanceof String field ? normalizeSort(field) : entry);
            }
        }
        return out;
    }

    static Map<String, Object> normalizeSort(String field) {
        String order = "_score".equals(field) ? "desc" : "asc";
        Map<String, Object> opts = new LinkedHashMap<>();
        opts.put("order", order);
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put(field, opts);
        return dsl;
    }

    /** Serializes a typed response object into a plain map. */
    public static Map<String, Object> toMap(JsonpSerializable value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        String json = toJson(value);
        try {
            return JSON.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read serialized response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Shard header of a response with integer counts. The JSON-P writer renders these counters as
     * {@code 1.0}, so they are read from the typed getters instead of {@link #toMap}.
     */
    public static Map<String, Object> shardsToMap(ShardStatistics shards) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (shards == null) {
            return out;
        }
        out.put("total", count(shards.total()));
        out.put("successful", count(shards.successful()));
        out.put("failed", count(shards.failed()));
        if (shards.skipped() != null) {
            out.put("skipped", count(shards.skipped()));
        }
        if (shards.failures() != null && !shards.failures().isEmpty()) {
            List<Object> failures = new ArrayList<>();
            shards.failures().forEach(f -> failures.add(toMap(f)));
            out.put("failures", failures);
        }
        return out;
    }

    private static int count(Number n) {
        return n == null ? 0 : n.intValue();
    }

    /** Aggregation results keyed by name, each rendered as a plain map. */
    public static Map<String, Object> aggregatesToMap(Map<String, Aggregate> aggregates) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (aggregates != null) {
            aggregates.forEach((name, agg) -> out.put(name, toMap(agg)));
        }
        return out;
    }

    public static String toJson(JsonpSerializable value) {
        StringWriter sw = new StringWriter();
        try (JsonGenerator generator = MAPPER.jsonProvider().createGenerator(sw)) {
            value.serialize(generator, MAPPER);
        }
        return sw.toString();
    }

    /** Compact JSON for a DSL map; used for request logging. */
    public static String write(Object dsl) {
        try {
            return JSON.writeValueAsString(dsl);
        } catch (JsonProcessingException e) {
            throw new SearchQueryException("DSL is not serializable: " + e.getOriginalMessage());
        }
    }

    private static <T> T deserialize(Object dsl, JsonpDeserializer<T> deserializer, String what) {
        String json = write(dsl);
        try (JsonParser parser = Json.createParser(new StringReader(json))) {
            return deserializer.deserialize(parser, MAPPER);
        } catch (RuntimeException e) {
            if (e instanceof SearchQueryException) {
                throw e;
            }
            throw new SearchQueryException("Invalid " + what + " DSL: " + e.getMessage(), asMap(dsl), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object dsl) {
        if (dsl instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) m).forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
            return copy;
        }
        return null;
    }
}
