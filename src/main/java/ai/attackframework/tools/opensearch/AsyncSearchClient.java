package ai.attackframework.tools.opensearch;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import ai.attackframework.tools.opensearch.model.BulkOperationResult;
import ai.attackframework.tools.opensearch.model.ConnectionStatus;
import ai.attackframework.tools.opensearch.model.SearchQuery;
import ai.attackframework.tools.opensearch.model.SearchResult;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Non-blocking counterpart of {@link SearchClient}. Futures complete exceptionally with the same
 * library exceptions the blocking client throws.
 */
public interface AsyncSearchClient extends AutoCloseable {

    CompletableFuture<SearchResult> search(String indexName, SearchQuery query);

    default CompletableFuture<SearchResult> search(String indexName, Map<String, Object> query) {
        return search(indexName, SearchQuery.builder().query(query).build());
    }

    CompletableFuture<Optional<Map<String, Object>>> getDocument(String indexName, String documentId,
                                                                 List<String> sourceFields);

    default CompletableFuture<Optional<Map<String, Object>>> getDocument(String indexName, String documentId) {
        return getDocument(indexName, documentId, null);
    }

    CompletableFuture<Boolean> exists(String indexName, String documentId);

    CompletableFuture<List<Map<String, Object>>> scrollSearch(String indexName, Map<String, Object> query,
                                                              String scroll, int batchSize);

    default CompletableFuture<List<Map<String, Object>>> scrollSearch(String indexName, Map<String, Object> query) {
        return scrollSearch(indexName, query, OpenSearchDefaults.SCROLL_KEEP_ALIVE, OpenSearchDefaults.SCROLL_BATCH_SIZE);
    }

    CompletableFuture<Map<String, Object>> aggregate(String indexName, Map<String, Object> aggs,
                                                     Map<String, Object> query);

    CompletableFuture<String> indexDocument(String indexName, Map<String, ?> document, String documentId,
                                            boolean refresh);

    CompletableFuture<Boolean> updateDocument(String indexName, String documentId, Map<String, ?> partial,
                                              boolean refresh);

    CompletableFuture<Boolean> deleteDocument(String indexName, String documentId, boolean refresh);

    CompletableFuture<BulkOperationResult> bulkIndex(String indexName, List<? extends Map<String, ?>> documents,
                                                     boolean refresh, int batchSize);

    default CompletableFuture<BulkOperationResult> bulkIndex(String indexName, List<? extends Map<String, ?>> documents) {
        return bulkIndex(indexName, documents, false, OpenSearchDefaults.BULK_BATCH_SIZE);
    }

    CompletableFuture<BulkOperationResult> bulkUpdate(String indexName, List<? extends Map<String, ?>> updates,
                                                      boolean refresh);

    CompletableFuture<BulkOperationResult> bulkDelete(String indexName, List<String> documentIds, boolean refresh);

    CompletableFuture<SearchResult> productSearch(ProductSearchRequest request);

    CompletableFuture<List<String>> autocomplete(String indexName, String field, String prefix, int size);

    CompletableFuture<List<Map<String, Object>>> moreLikeThis(String indexName, String documentId,
                                                              List<String> fields, int maxResults);

    CompletableFuture<Boolean> createIndex(String indexName, Map<String, Object> mappings,
                                           Map<String, Object> settings, Map<String, Object> aliases);

    CompletableFuture<Boolean> deleteIndex(String indexName);

    CompletableFuture<Boolean> indexExists(String indexName);

    CompletableFuture<Map<String, Object>> getIndexSettings(String indexName);

    CompletableFuture<Boolean> updateIndexSettings(String indexName, Map<String, Object> settings);

    CompletableFuture<Boolean> refreshIndex(String indexName);

    CompletableFuture<Boolean> flushIndex(String indexName);

    CompletableFuture<Map<String, Object>> getIndexStats(String indexName);

    CompletableFuture<Map<String, Object>> clusterHealth();

    CompletableFuture<ConnectionStatus> testConnection();

    /** Stops the worker pool and closes the underlying client. */
    @Override
    void close();
}
