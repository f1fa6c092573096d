package ai.attackframework.tools.opensearch;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import ai.attackframework.tools.opensearch.model.BulkOperationResult;
import ai.attackframework.tools.opensearch.model.ConnectionStatus;
import ai.attackframework.tools.opensearch.model.SearchQuery;
import ai.attackframework.tools.opensearch.model.SearchResult;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Blocking search, document, bulk and index operations against one cluster.
 *
 * <p>Failures surface as subclasses of
 * {@link ai.attackframework.tools.opensearch.errors.OpenSearchOperationException}.</p>
 */
public interface SearchClient extends AutoCloseable {

    // ---- search ----

    SearchResult search(String indexName, SearchQuery query);

    /** Query with default paging and no sort, aggregations or highlighting. */
    default SearchResult search(String indexName, Map<String, Object> query) {
        return search(indexName, SearchQuery.builder().query(query).build());
    }

    /**
     * Source of one document plus {@code _id}, {@code _index} and {@code _version}.
     *
     * @param sourceFields fields to fetch, or {@code null} for the whole source
     * @return empty when the document or its index does not exist
     */
    Optional<Map<String, Object>> getDocument(String indexName, String documentId, List<String> sourceFields);

    default Optional<Map<String, Object>> getDocument(String indexName, String documentId) {
        return getDocument(indexName, documentId, null);
    }

    boolean exists(String indexName, String documentId);

    /** All hits for {@code query}, paging with a scroll context that is cleared at the end. */
    List<Map<String, Object>> scrollSearch(String indexName, Map<String, Object> query, String scroll, int batchSize);

    default List<Map<String, Object>> scrollSearch(String indexName, Map<String, Object> query) {
        return scrollSearch(indexName, query, OpenSearchDefaults.SCROLL_KEEP_ALIVE, OpenSearchDefaults.SCROLL_BATCH_SIZE);
    }

    /** Size-0 search; returns the aggregation results keyed by name. */
    Map<String, Object> aggregate(String indexName, Map<String, Object> aggs, Map<String, Object> query);

    // ---- documents ----

    /** @return the supplied id, or the id generated by the cluster */
    String indexDocument(String indexName, Map<String, ?> document, String documentId, boolean refresh);

    boolean updateDocument(String indexName, String documentId, Map<String, ?> partial, boolean refresh);

    /** @return {@code false} when the document did not exist */
    boolean deleteDocument(String indexName, String documentId, boolean refresh);

    // ---- bulk ----

    BulkOperationResult bulkIndex(String indexName, List<? extends Map<String, ?>> documents, boolean refresh, int batchSize);

    default BulkOperationResult bulkIndex(String indexName, List<? extends Map<String, ?>> documents) {
        return bulkIndex(indexName, documents, false, OpenSearchDefaults.BULK_BATCH_SIZE);
    }

    BulkOperationResult bulkUpdate(String indexName, List<? extends Map<String, ?>> updates, boolean refresh);

    BulkOperationResult bulkDelete(String indexName, List<String> documentIds, boolean refresh);

    // ---- e-commerce ----

    SearchResult productSearch(ProductSearchRequest request);

    List<String> autocomplete(String indexName, String field, String prefix, int size);

    List<Map<String, Object>> moreLikeThis(String indexName, String documentId, List<String> fields, int maxResults);

    // ---- index management ----

    boolean createIndex(String indexName, Map<String, Object> mappings, Map<String, Object> settings,
                        Map<String, Object> aliases);

    boolean deleteIndex(String indexName);

    boolean indexExists(String indexName);

    Map<String, Object> getIndexSettings(String indexName);

    boolean updateIndexSettings(String indexName, Map<String, Object> settings);

    boolean refreshIndex(String indexName);

    boolean flushIndex(String indexName);

    Map<String, Object> getIndexStats(String indexName);

    Map<String, Object> clusterHealth();

    /** Never throws; failures are reported in the returned status. */
    ConnectionStatus testConnection();

    @Override
    void close();
}
