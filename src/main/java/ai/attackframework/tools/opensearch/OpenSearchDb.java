package ai.attackframework.tools.opensearch;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import ai.attackframework.tools.opensearch.bulk.BulkProcessor;
import ai.attackframework.tools.opensearch.bulk.RetryQueue;
import ai.attackframework.tools.opensearch.errors.IndexNotFoundException;
import ai.attackframework.tools.opensearch.errors.OpenSearchErrors;
import ai.attackframework.tools.opensearch.errors.OpenSearchOperationException;
import ai.attackframework.tools.opensearch.errors.OperationTimeoutException;
import ai.attackframework.tools.opensearch.errors.ResourceExistsException;
import ai.attackframework.tools.opensearch.model.BulkOperationResult;
import ai.attackframework.tools.opensearch.model.ConnectionStatus;
import ai.attackframework.tools.opensearch.model.SearchQuery;
import ai.attackframework.tools.opensearch.model.SearchResult;
import ai.attackframework.tools.opensearch.query.OpenSearchQueryBuilder;
import ai.attackframework.tools.opensearch.stats.OpenSearchStats;
import ai.attackframework.tools.opensearch.stats.OperationType;
import ai.attackframework.tools.opensearch.utils.DslJson;
import ai.attackframework.tools.opensearch.utils.Logger;
import ai.attackframework.tools.opensearch.utils.OpenSearchUtils;
import ai.attackframework.tools.opensearch.utils.RetryHandler;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchConfig;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;
import ai.attackframework.tools.opensearch.utils.opensearch.OpenSearchConnector;
import ai.attackframework.tools.opensearch.utils.opensearch.OpenSearchLogFormat;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.Refresh;
import org.opensearch.client.opensearch._types.SearchType;
import org.opensearch.client.opensearch.core.DeleteResponse;
import org.opensearch.client.opensearch.core.GetResponse;
import org.opensearch.client.opensearch.core.IndexRequest;
import org.opensearch.client.opensearch.core.IndexResponse;
import org.opensearch.client.opensearch.core.InfoResponse;
import org.opensearch.client.opensearch.core.ScrollResponse;
import org.opensearch.client.opensearch.core.SearchRequest;
import org.opensearch.client.opensearch.core.SearchResponse;
import org.opensearch.client.opensearch.core.UpdateRequest;
import org.opensearch.client.opensearch.core.UpdateResponse;
import org.opensearch.client.opensearch.core.search.CompletionSuggestOption;
import org.opensearch.client.opensearch.core.search.HitsMetadata;
import org.opensearch.client.opensearch.core.search.Suggest;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.CreateIndexResponse;
import org.opensearch.client.opensearch.indices.GetIndicesSettingsResponse;

/**
 * Blocking {@link SearchClient} over the opensearch-java client.
 *
 * <p>Each operation is retried on transient failures (up to {@code maxRetries} extra attempts,
 * exponential backoff), recorded in {@link #stats()} and, on failure, rethrown through
 * {@link OpenSearchErrors#wrap(Throwable, String)}.</p>
 *
 * <p>Thread-safe: the underlying client is shared and stats are synchronized.</p>
 */
public class OpenSearchDb implements SearchClient {

    @SuppressWarnings("unchecked")
    static final Class<Map<String, Object>> MAP_DOCTYPE = (Class<Map<String, Object>>) (Class<?>) Map.class;

    private final OpenSearchClient client;
    private final OpenSearchConfig config;
    private final boolean ownsClient;
    private final OpenSearchStats stats;
    private final RetryQueue retryQueue = new RetryQueue(OpenSearchDefaults.RETRY_QUEUE_CAPACITY);

    /** Uses the cached client for {@code config}; {@link #close()} releases it. */
    public OpenSearchDb(OpenSearchConfig config) {
        this(OpenSearchConnector.getClient(config), config, true, new OpenSearchStats());
        Logger.logInfo("[OpenSearch] Client initialized for hosts: " + config.hosts());
        if (config.isAws()) {
            Logger.logInfo("[OpenSearch] AWS region: " + config.awsRegion() + ", service: " + config.awsService());
        }
    }

    /** Wraps a caller-supplied client; {@link #close()} closes its transport. */
    public OpenSearchDb(OpenSearchClient client, OpenSearchConfig config) {
        this(client, config, false, new OpenSearchStats());
    }

    OpenSearchDb(OpenSearchClient client, OpenSearchConfig config, boolean ownsClient, OpenSearchStats stats) {
        this.client = client;
        this.config = config;
        this.ownsClient = ownsClient;
        this.stats = stats;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Live statistics are shared with the caller, not copied.")
    public OpenSearchStats stats() {
        return stats;
    }

    public OpenSearchConfig config() {
        return config;
    }

    // ---- search ----

    @Override
    public SearchResult search(String indexName, SearchQuery query) {
        Map<String, Object> body = searchBody(query);
        SearchType searchType = query.searchType() == ai.attackframework.tools.opensearch.model.SearchType.DFS_QUERY_THEN_FETCH
                ? SearchType.DfsQueryThenFetch
                : null;
        SearchResult result = execute(OperationType.SEARCH, indexName, "Search failed for index " + indexName,
                () -> toResult(runSearch(indexName, body, searchType, null)));
        if (result.tookMs() > OpenSearchDefaults.SLOW_QUERY_THRESHOLD_MS) {
            Logger.logWarn("[OpenSearch] Slow search on index " + indexName + ": " + result.tookMs() + "ms");
        }
        return result;
    }

    @Override
    public Optional<Map<String, Object>> getDocument(String indexName, String documentId, List<String> sourceFields) {
        String context = "Failed to get document " + documentId + " from index " + indexName;
        try {
            return execute(OperationType.SEARCH, indexName, context, () -> {
                GetResponse<Map<String, Object>> response = client.get(g -> {
                    g.index(indexName).id(documentId);
                    if (sourceFields != null && !sourceFields.isEmpty()) {
                        g.sourceIncludes(sourceFields);
                    }
                    return g;
                }, MAP_DOCTYPE);
                if (!response.found()) {
                    return Optional.empty();
                }
                Map<String, Object> doc = new LinkedHashMap<>();
                if (response.source() != null) {
                    doc.putAll(response.source());
                }
                doc.put("_id", response.id());
                doc.put("_index", response.index());
                doc.put("_version", response.version());
                return Optional.of(doc);
            });
        } catch (OpenSearchOperationException e) {
            if (OpenSearchErrors.isNotFound(e)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public boolean exists(String indexName, String documentId) {
        return execute(OperationType.SEARCH, indexName,
                "Failed to check document " + documentId + " in index " + indexName,
                () -> client.exists(e -> e.index(indexName).id(documentId)).value());
    }

    @Override
    public List<Map<String, Object>> scrollSearch(String indexName, Map<String, Object> query, String scroll, int batchSize) {
        Map<String, Object> body = OpenSearchUtils.buildScrollQuery(query, batchSize);
        body.put("sort", DslJson.expandSort((List<?>) body.get("sort")));
        return execute(OperationType.SEARCH, indexName, "Scroll search failed for index " + indexName, () -> {
            SearchResponse<Map<String, Object>> first = runSearch(indexName, body, null, scroll);
            List<Map<String, Object>> all = new ArrayList<>(hits(first.hits()));
            String scrollId = first.scrollId();
            try {
                while (scrollId != null) {
                    String current = scrollId;
                    ScrollResponse<Map<String, Object>> page = client.scroll(
                            s -> s.scrollId(current).scroll(t -> t.time(scroll)), MAP_DOCTYPE);
                    List<Map<String, Object>> pageHits = hits(page.hits());
                    if (pageHits.isEmpty()) {
                        break;
                    }
                    all.addAll(pageHits);
                    if (page.scrollId() != null) {
                        scrollId = page.scrollId();
                    }
                }
            } finally {
                clearScroll(scrollId);
            }
            Logger.logDebug("[OpenSearch] Scroll search on " + indexName + " returned " + all.size() + " documents");
            return all;
        });
    }

    private void clearScroll(String scrollId) {
        if (scrollId == null) {
            return;
        }
        try {
            client.clearScroll(c -> c.scrollId(scrollId));
        } catch (IOException | RuntimeException e) {
            Logger.logWarn("[OpenSearch] Failed to clear scroll context: " + e.getMessage());
        }
    }

    @Override
    public Map<String, Object> aggregate(String indexName, Map<String, Object> aggs, Map<String, Object> query) {
        Map<String, Object> body = OpenSearchQueryBuilder.buildAggregationQuery(aggs, query);
        return execute(OperationType.SEARCH, indexName, "Aggregation failed for index " + indexName,
                () -> DslJson.aggregatesToMap(runSearch(indexName, body, null, null).aggregations()));
    }

    // ---- documents ----

    @Override
    public String indexDocument(String indexName, Map<String, ?> document, String documentId, boolean refresh) {
        Map<String, Object> source = OpenSearchUtils.normalizeDocument(document);
        return execute(OperationType.INDEX, indexName, "Failed to index document in " + indexName, () -> {
            IndexRequest.Builder<Map<String, Object>> request = new IndexRequest.Builder<Map<String, Object>>()
                    .index(indexName)
                    .document(source);
            if (documentId != null) {
                request.id(documentId);
            }
            if (refresh) {
                request.refresh(Refresh.True);
            }
            IndexResponse response = client.index(request.build());
            return response.id();
        });
    }

    @Override
    public boolean updateDocument(String indexName, String documentId, Map<String, ?> partial, boolean refresh) {
        Map<String, Object> doc = OpenSearchUtils.normalizeDocument(partial);
        return execute(OperationType.UPDATE, indexName,
                "Failed to update document " + documentId + " in " + indexName, () -> {
                    UpdateRequest<Map<String, Object>, Map<String, Object>> request =
                            new UpdateRequest.Builder<Map<String, Object>, Map<String, Object>>()
                                    .index(indexName)
                                    .id(documentId)
                                    .doc(doc)
                                    .refresh(refresh ? Refresh.True : Refresh.False)
                                    .build();
                    UpdateResponse<Map<String, Object>> response = client.update(request, MAP_DOCTYPE);
                    String result = response.result().jsonValue();
                    return "updated".equals(result) || "noop".equals(result);
                });
    }

    @Override
    public boolean deleteDocument(String indexName, String documentId, boolean refresh) {
        try {
            return execute(OperationType.DELETE, indexName,
                    "Failed to delete document " + documentId + " from " + indexName, () -> {
                        DeleteResponse response = client.delete(d -> d.index(indexName).id(documentId)
                                .refresh(refresh ? Refresh.True : Refresh.False));
                        return "deleted".equals(response.result().jsonValue());
                    });
        } catch (OpenSearchOperationException e) {
            if (OpenSearchErrors.isNotFound(e)) {
                return false;
            }
            throw e;
        }
    }

    // ---- bulk ----

    @Override
    public BulkOperationResult bulkIndex(String indexName, List<? extends Map<String, ?>> documents, boolean refresh,
                                         int batchSize) {
        BulkProcessor processor = bulkProcessor(batchSize, refresh);
        return recordBulk(indexName, documents == null ? 0 : documents.size(),
                () -> processor.processBulkIndex(indexName, documents, null));
    }

    @Override
    public BulkOperationResult bulkUpdate(String indexName, List<? extends Map<String, ?>> updates, boolean refresh) {
        BulkProcessor processor = bulkProcessor(OpenSearchDefaults.BULK_BATCH_SIZE, refresh);
        return recordBulk(indexName, updates == null ? 0 : updates.size(),
                () -> processor.processBulkUpdate(indexName, updates));
    }

    @Override
    public BulkOperationResult bulkDelete(String indexName, List<String> documentIds, boolean refresh) {
        BulkProcessor processor = bulkProcessor(OpenSearchDefaults.BULK_BATCH_SIZE, refresh);
        return recordBulk(indexName, documentIds == null ? 0 : documentIds.size(),
                () -> processor.processBulkDelete(indexName, documentIds));
    }

    /** Resends actions parked after failed bulk calls on {@code indexName}. */
    public BulkOperationResult drainRetryQueue(String indexName) {
        return bulkProcessor(OpenSearchDefaults.BULK_BATCH_SIZE, false).drainRetryQueue(indexName);
    }

    public int queuedCount(String indexName) {
        return retryQueue.size(indexName);
    }

    private BulkProcessor bulkProcessor(int batchSize, boolean refresh) {
        return BulkProcessor.builder(client)
                .batchSize(batchSize)
                .refreshAfterBatch(refresh)
                .retryQueue(retryQueue)
                .build();
    }

    private BulkOperationResult recordBulk(String indexName, int docCount, Callable<BulkOperationResult> call) {
        long start = System.nanoTime();
        try {
            BulkOperationResult result = call.call();
            stats.recordOperation(OperationType.BULK, indexName, elapsedMs(start), !result.hasErrors(),
                    docCount, result.successful(), result.failed());
            return result;
        } catch (Exception e) {
            stats.recordOperation(OperationType.BULK, indexName, elapsedMs(start), false, docCount, 0, docCount);
            throw OpenSearchErrors.wrap(e, "Bulk operation failed for index " + indexName);
        }
    }

    // ---- e-commerce ----

    @Override
    public SearchResult productSearch(ProductSearchRequest request) {
        Map<String, Object> query = OpenSearchQueryBuilder.buildProductSearchQuery(request.text(), request.filters(),
                request.category(), request.priceRange(), request.brand(), request.attributes(), request.inStock());
        SearchQuery search = SearchQuery.builder()
                .query(query)
                .aggs(OpenSearchQueryBuilder.buildProductFacets())
                .sort(request.sortBy().sortOptions())
                .size(request.perPage())
                .from(request.from())
                .source(true)
                .build();
        return search(OpenSearchDefaults.PRODUCTS_INDEX, search);
    }

    @Override
    public List<String> autocomplete(String indexName, String field, String prefix, int size) {
        Map<String, Object> body = new LinkedHashMap<>(OpenSearchQueryBuilder.buildAutocompleteQuery(field, prefix, size));
        body.put("_source", false);
        return execute(OperationType.SEARCH, indexName,
                "Autocomplete failed for field " + field + " in index " + indexName, () -> {
                    SearchResponse<Map<String, Object>> response = runSearch(indexName, body, null, null);
                    List<String> suggestions = new ArrayList<>();
                    List<Suggest<Map<String, Object>>> entries = response.suggest() == null
                            ? List.of()
                            : response.suggest().getOrDefault("autocomplete", List.of());
                    for (Suggest<Map<String, Object>> entry : entries) {
                        if (!entry.isCompletion()) {
                            continue;
                        }
                        for (CompletionSuggestOption<Map<String, Object>> option : entry.completion().options()) {
                            suggestions.add(option.text());
                        }
                    }
                    return suggestions.size() > size ? new ArrayList<>(suggestions.subList(0, size)) : suggestions;
                });
    }

    @Override
    public List<Map<String, Object>> moreLikeThis(String indexName, String documentId, List<String> fields,
                                                  int maxResults) {
        Map<String, Object> like = new LinkedHashMap<>();
        like.put("_id", documentId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", OpenSearchQueryBuilder.buildMoreLikeThisQuery(fields, null, List.of(like)));
        body.put("size", maxResults);
        return execute(OperationType.SEARCH, indexName,
                "More like this failed for " + documentId + " in index " + indexName,
                () -> hits(runSearch(indexName, body, null, null).hits()));
    }

    // ---- index management ----

    @Override
    public boolean createIndex(String indexName, Map<String, Object> mappings, Map<String, Object> settings,
                               Map<String, Object> aliases) {
        OpenSearchUtils.validateIndexName(indexName);
        try {
            return call("Failed to create index " + indexName, () -> {
                CreateIndexRequest.Builder request = new CreateIndexRequest.Builder().index(indexName);
                if (settings != null && !settings.isEmpty()) {
                    request.settings(DslJson.indexSettings(settings));
                }
                if (mappings != null && !mappings.isEmpty()) {
                    request.mappings(DslJson.typeMapping(mappings));
                }
                if (aliases != null && !aliases.isEmpty()) {
                    request.aliases(DslJson.aliases(aliases));
                }
                CreateIndexResponse response = client.indices().create(request.build());
                boolean ack = Boolean.TRUE.equals(response.acknowledged());
                Logger.logInfo("[OpenSearch] Index " + indexName + (ack ? " created" : " creation not acknowledged"));
                return ack;
            });
        } catch (ResourceExistsException e) {
            Logger.logWarn("[OpenSearch] Index " + indexName + " already exists");
            return true;
        }
    }

    @Override
    public boolean deleteIndex(String indexName) {
        try {
            return call("Failed to delete index " + indexName,
                    () -> Boolean.TRUE.equals(client.indices().delete(d -> d.index(indexName)).acknowledged()));
        } catch (IndexNotFoundException e) {
            Logger.logWarn("[OpenSearch] Index " + indexName + " does not exist");
            return true;
        }
    }

    @Override
    public boolean indexExists(String indexName) {
        return call("Failed to check index " + indexName,
                () -> client.indices().exists(e -> e.index(indexName)).value());
    }

    @Override
    public Map<String, Object> getIndexSettings(String indexName) {
        return call("Failed to get settings for index " + indexName, () -> {
            GetIndicesSettingsResponse response = client.indices().getSettings(g -> g.index(indexName));
            Map<String, Object> out = new LinkedHashMap<>();
            response.result().forEach((name, state) -> out.put(name, DslJson.toMap(state)));
            return out;
        });
    }

    @Override
    public boolean updateIndexSettings(String indexName, Map<String, Object> settings) {
        return call("Failed to update settings for index " + indexName, () -> Boolean.TRUE.equals(
                client.indices().putSettings(p -> p.index(indexName).settings(DslJson.indexSettings(settings)))
                        .acknowledged()));
    }

    @Override
    public boolean refreshIndex(String indexName) {
        return call("Failed to refresh index " + indexName,
                () -> noShardFailures(DslJson.shardsToMap(client.indices().refresh(r -> r.index(indexName)).shards())));
    }

    @Override
    public boolean flushIndex(String indexName) {
        return call("Failed to flush index " + indexName,
                () -> noShardFailures(DslJson.shardsToMap(client.indices().flush(f -> f.index(indexName)).shards())));
    }

    private static boolean noShardFailures(Map<String, Object> shards) {
        Object failed = shards.get("failed");
        return !(failed instanceof Number n) || n.intValue() == 0;
    }

    @Override
    public Map<String, Object> getIndexStats(String indexName) {
        return call("Failed to get stats for index " + indexName,
                () -> DslJson.toMap(client.indices().stats(s -> s.index(indexName))));
    }

    @Override
    public Map<String, Object> clusterHealth() {
        Map<String, Object> health = call("Failed to get cluster health",
                () -> DslJson.toMap(client.cluster().health()));
        stats.recordClusterHealth(health);
        return health;
    }

    @Override
    public ConnectionStatus testConnection() {
        String baseUrl = config.hosts().get(0);
        try {
            Logger.logDebug("[OpenSearch] Request:\n" + OpenSearchLogFormat.indentRaw(
                    OpenSearchLogFormat.buildRawRequest(baseUrl, "GET", "/", "")));
            InfoResponse info = client.info();
            String version = info.version().number();
            String distribution = info.version().distribution();
            Logger.logDebug("[OpenSearch] Response:\n" + OpenSearchLogFormat.indentRaw(
                    OpenSearchLogFormat.buildRawResponse(200, DslJson.toJson(info))));
            return new ConnectionStatus(true, distribution, version, "Connection successful");
        } catch (Exception e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            Logger.logError("[OpenSearch] Connection failed for " + baseUrl + ": " + msg);
            StringWriter sw = new StringWriter();
            e.printStackTrace(new PrintWriter(sw));
            Logger.logError(sw.toString().stripTrailing());
            return new ConnectionStatus(false, "", "", msg);
        }
    }

    @Override
    public void close() {
        if (ownsClient) {
            OpenSearchConnector.release(config);
            return;
        }
        try {
            client._transport().close();
        } catch (IOException e) {
            Logger.logWarn("[OpenSearch] Failed to close transport: " + e.getMessage());
        }
    }

    // ---- internals ----

    private SearchResponse<Map<String, Object>> runSearch(String indexName, Map<String, Object> body,
                                                         SearchType searchType, String scroll) throws IOException {
        SearchRequest.Builder request = DslJson.searchRequest(body).toBuilder().index(indexName);
        if (searchType != null) {
            request.searchType(searchType);
        }
        if (scroll != null) {
            request.scroll(t -> t.time(scroll));
        }
        return client.search(request.build(), MAP_DOCTYPE);
    }

    static Map<String, Object> searchBody(SearchQuery query) {
        Map<String, Object> body = query.toBody();
        if (query.size() > OpenSearchDefaults.MAX_RESULT_WINDOW) {
            Logger.logWarn("[OpenSearch] Search size " + query.size() + " capped at " + OpenSearchDefaults.MAX_RESULT_WINDOW);
        }
        body.put("size", Math.min(Math.max(query.size(), 0), OpenSearchDefaults.MAX_RESULT_WINDOW));
        if (body.get("sort") instanceof List<?> sort) {
            body.put("sort", DslJson.expandSort(sort));
        }
        return body;
    }

    private static SearchResult toResult(SearchResponse<Map<String, Object>> response) {
        List<Map<String, Object>> hits = hits(response.hits());
        long total = response.hits().total() == null ? hits.size() : response.hits().total().value();
        return new SearchResult(hits, total, response.took(), DslJson.aggregatesToMap(response.aggregations()),
                response.scrollId(), DslJson.shardsToMap(response.shards()));
    }

    private static List<Map<String, Object>> hits(HitsMetadata<Map<String, Object>> hits) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("hits", DslJson.toMap(hits));
        return OpenSearchUtils.extractHits(response);
    }

    private <T> T execute(OperationType type, String indexName, String context, Callable<T> operation) {
        long start = System.nanoTime();
        try {
            T result = RetryHandler.retryWithBackoff(operation, config.maxRetries() + 1,
                    OpenSearchDefaults.RETRY_BASE_DELAY_MS, this::isRetryable);
            stats.recordOperation(type, indexName, elapsedMs(start), true);
            return result;
        } catch (Exception e) {
            stats.recordOperation(type, indexName, elapsedMs(start), false);
            throw OpenSearchErrors.wrap(e, context);
        }
    }

    private <T> T call(String context, Callable<T> operation) {
        try {
            return RetryHandler.retryWithBackoff(operation, config.maxRetries() + 1,
                    OpenSearchDefaults.RETRY_BASE_DELAY_MS, this::isRetryable);
        } catch (Exception e) {
            throw OpenSearchErrors.wrap(e, context);
        }
    }

    private boolean isRetryable(Throwable error) {
        if (!RetryHandler.shouldRetry(error)) {
            return false;
        }
        return config.retryOnTimeout() || !(OpenSearchErrors.wrap(error, "") instanceof OperationTimeoutException);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
