package ai.attackframework.tools.opensearch.index;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ai.attackframework.tools.opensearch.errors.IndexNotFoundException;
import ai.attackframework.tools.opensearch.errors.OpenSearchErrors;
import ai.attackframework.tools.opensearch.errors.OpenSearchOperationException;
import ai.attackframework.tools.opensearch.model.IndexSettingsSpec;
import ai.attackframework.tools.opensearch.utils.DslJson;
import ai.attackframework.tools.opensearch.utils.Logger;
import ai.attackframework.tools.opensearch.utils.OpenSearchUtils;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch.core.ReindexResponse;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.CreateIndexResponse;
import org.opensearch.client.opensearch.indices.ForcemergeResponse;
import org.opensearch.client.opensearch.indices.GetAliasResponse;

/**
 * Index administration beyond plain create/delete: time-series indexes, aliases, reindex and
 * force merge.
 */
public class IndexManager {

    static final DateTimeFormatter TIME_SERIES_SUFFIX = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private final OpenSearchClient client;
    private final Clock clock;

    public IndexManager(OpenSearchClient client) {
        this(client, Clock.systemUTC());
    }

    public IndexManager(OpenSearchClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    /**
     * Creates an index, applying {@link IndexSettingsSpec#defaults()} when {@code settings} is empty.
     *
     * @return acknowledgement; {@code true} when the index already exists
     * @throws ai.attackframework.tools.opensearch.errors.ValidationException for an invalid name
     * @throws OpenSearchOperationException when creation fails for any other reason
     */
    public boolean createIndexWithSettings(String indexName, Map<String, Object> mappings,
                                           Map<String, Object> settings, Map<String, Object> aliases) {
        OpenSearchUtils.validateIndexName(indexName);
        Map<String, Object> effective = settings == null || settings.isEmpty()
                ? IndexSettingsSpec.defaults().toDsl()
                : settings;
        try {
            CreateIndexRequest.Builder request = new CreateIndexRequest.Builder()
                    .index(indexName)
                    .settings(DslJson.indexSettings(effective));
            if (mappings != null && !mappings.isEmpty()) {
                request.mappings(DslJson.typeMapping(mappings));
            }
            if (aliases != null && !aliases.isEmpty()) {
                request.aliases(DslJson.aliases(aliases));
            }
            CreateIndexResponse response = client.indices().create(request.build());
            boolean acknowledged = Boolean.TRUE.equals(response.acknowledged());
            if (acknowledged) {
                Logger.logInfo("[OpenSearch] Index '" + indexName + "' created successfully");
            } else {
                Logger.logWarn("[OpenSearch] Index '" + indexName + "' creation not acknowledged");
            }
            return acknowledged;
        } catch (IOException | RuntimeException e) {
            String type = OpenSearchErrors.errorType(e);
            String text = type != null ? type : String.valueOf(e.getMessage());
            if (text.contains("resource_already_exists")) {
                Logger.logWarn("[OpenSearch] Index '" + indexName + "' already exists");
                return true;
            }
            String context = "Failed to create index '" + indexName + "'";
            Logger.logError("[OpenSearch] " + context + ": " + e.getMessage());
            throw OpenSearchErrors.wrap(e, context);
        }
    }

    /**
     * Creates {@code <prefix>-yyyy.MM.dd} for the current UTC date and points alias {@code prefix} at it.
     *
     * @return the index name, or an empty string when creation failed
     */
    public String createTimeSeriesIndex(String indexPrefix, Map<String, Object> mappings, Map<String, Object> settings) {
        String indexName = indexPrefix + "-" + LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(TIME_SERIES_SUFFIX);
        boolean created;
        try {
            created = createIndexWithSettings(indexName, mappings, settings, null);
        } catch (OpenSearchOperationException e) {
            Logger.logError("[OpenSearch] Time-series index '" + indexName + "' not created: " + e.getMessage());
            return "";
        }
        if (!created) {
            return "";
        }
        createAlias(indexPrefix, indexName, null, null);
        Logger.logInfo("[OpenSearch] Time-series index '" + indexName + "' created with alias '" + indexPrefix + "'");
        return indexName;
    }

    /** Adds {@code aliasName} to {@code indexName}; failures are logged and reported as {@code false}. */
    public boolean createAlias(String aliasName, String indexName, Map<String, Object> filter, String routing) {
        try {
            return Boolean.TRUE.equals(client.indices().updateAliases(u -> u.actions(a -> a.add(add -> {
                add.index(indexName).alias(aliasName);
                if (filter != null && !filter.isEmpty()) {
                    add.filter(DslJson.query(filter));
                }
                if (routing != null) {
                    add.routing(routing);
                }
                return add;
            }))).acknowledged());
        } catch (IOException | RuntimeException e) {
            Logger.logError("[OpenSearch] Failed to create alias '" + aliasName + "' for index '"
                    + indexName + "': " + e.getMessage());
            return false;
        }
    }

    /**
     * Alias names on {@code indexName}.
     *
     * @throws IndexNotFoundException when the index does not exist
     */
    public List<String> getIndexAliases(String indexName) {
        try {
            GetAliasResponse response = client.indices().getAlias(g -> g.index(indexName));
            List<String> aliases = new ArrayList<>();
            response.result().values().forEach(index -> aliases.addAll(index.aliases().keySet()));
            return aliases;
        } catch (IOException | RuntimeException e) {
            String type = OpenSearchErrors.errorType(e);
            if ((type != null && type.contains("index_not_found"))
                    || String.valueOf(e.getMessage()).contains("index_not_found")) {
                throw new IndexNotFoundException(indexName, e);
            }
            Logger.logError("[OpenSearch] Failed to get aliases for index '" + indexName + "': " + e.getMessage());
            return List.of();
        }
    }

    public Map<String, Object> reindex(String sourceIndex, String destIndex, Map<String, Object> query) {
        return reindex(sourceIndex, destIndex, query, 1000, true);
    }

    /**
     * Copies documents from {@code sourceIndex} to {@code destIndex}, optionally filtered by {@code query}.
     *
     * @return the reindex response as a map (a task reference when not waiting)
     */
    public Map<String, Object> reindex(String sourceIndex, String destIndex, Map<String, Object> query,
                                       int batchSize, boolean waitForCompletion) {
        try {
            ReindexResponse response = client.reindex(r -> r
                    .source(s -> {
                        s.index(sourceIndex).size(batchSize);
                        if (query != null && !query.isEmpty()) {
                            s.query(DslJson.query(query));
                        }
                        return s;
                    })
                    .dest(d -> d.index(destIndex))
                    .waitForCompletion(waitForCompletion));
            Map<String, Object> out = DslJson.toMap(response);
            Logger.logInfo("[OpenSearch] Reindex from '" + sourceIndex + "' to '" + destIndex + "' completed: "
                    + out.getOrDefault("total", 0) + " total, "
                    + out.getOrDefault("created", 0) + " created, "
                    + out.getOrDefault("updated", 0) + " updated");
            return out;
        } catch (IOException | RuntimeException e) {
            String context = "Reindex failed from '" + sourceIndex + "' to '" + destIndex + "'";
            Logger.logError("[OpenSearch] " + context + ": " + e.getMessage());
            throw OpenSearchErrors.wrap(e, context);
        }
    }

    public boolean optimizeIndex(String indexName) {
        return optimizeIndex(indexName, 1, false, true);
    }

    /** Force merge; {@code true} when no shard failed. */
    public boolean optimizeIndex(String indexName, int maxNumSegments, boolean onlyExpungeDeletes, boolean flush) {
        try {
            ForcemergeResponse response = client.indices().forcemerge(f -> f
                    .index(indexName)
                    .maxNumSegments((long) maxNumSegments)
                    .onlyExpungeDeletes(onlyExpungeDeletes)
                    .flush(flush));
            Object failed = DslJson.shardsToMap(response.shards()).get("failed");
            boolean ok = !(failed instanceof Number n) || n.intValue() == 0;
            Logger.logInfo("[OpenSearch] Force merge of '" + indexName + "' to " + maxNumSegments
                    + " segments " + (ok ? "completed" : "reported shard failures"));
            return ok;
        } catch (IOException | RuntimeException e) {
            throw OpenSearchErrors.wrap(e, "Failed to optimize index '" + indexName + "'");
        }
    }
}
