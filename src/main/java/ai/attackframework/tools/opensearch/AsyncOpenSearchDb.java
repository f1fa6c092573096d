package ai.attackframework.tools.opensearch;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import ai.attackframework.tools.opensearch.model.BulkOperationResult;
import ai.attackframework.tools.opensearch.model.ConnectionStatus;
import ai.attackframework.tools.opensearch.model.SearchQuery;
import ai.attackframework.tools.opensearch.model.SearchResult;
import ai.attackframework.tools.opensearch.utils.Logger;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * {@link AsyncSearchClient} that runs a blocking {@link SearchClient} on a bounded pool of named
 * daemon threads.
 *
 * <p>Ownership: {@link #close()} shuts the pool down and closes the delegate.</p>
 */
public class AsyncOpenSearchDb implements AsyncSearchClient {

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final SearchClient delegate;
    private final ExecutorService executor;

    public AsyncOpenSearchDb(SearchClient delegate, int poolSize) {
        this.delegate = delegate;
        int pool = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize), r -> {
            Thread t = new Thread(r, "opensearch-async-" + pool + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** The blocking client behind this one. */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Callers may use the blocking client directly.")
    public SearchClient delegate() {
        return delegate;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, executor);
    }

    @Override
    public CompletableFuture<SearchResult> search(String indexName, SearchQuery query) {
        return submit(() -> delegate.search(indexName, query));
    }

    @Override
    public CompletableFuture<Optional<Map<String, Object>>> getDocument(String indexName, String documentId,
                                                                        List<String> sourceFields) {
        return submit(() -> delegate.getDocument(indexName, documentId, sourceFields));
    }

    @Override
    public CompletableFuture<Boolean> exists(String indexName, String documentId) {
        return submit(() -> delegate.exists(indexName, documentId));
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> scrollSearch(String indexName, Map<String, Object> query,
                                                                     String scroll, int batchSize) {
        return submit(() -> delegate.scrollSearch(indexName, query, scroll, batchSize));
    }

    @Override
    public CompletableFuture<Map<String, Object>> aggregate(String indexName, Map<String, Object> aggs,
                                                            Map<String, Object> query) {
        return submit(() -> delegate.aggregate(indexName, aggs, query));
    }

    @Override
    public CompletableFuture<String> indexDocument(String indexName, Map<String, ?> document, String documentId,
                                                   boolean refresh) {
        return submit(() -> delegate.indexDocument(indexName, document, documentId, refresh));
    }

    @Override
    public CompletableFuture<Boolean> updateDocument(String indexName, String documentId, Map<String, ?> partial,
                                                     boolean refresh) {
        return submit(() -> delegate.updateDocument(indexName, documentId, partial, refresh));
    }

    @Override
    public CompletableFuture<Boolean> deleteDocument(String indexName, String documentId, boolean refresh) {
        return submit(() -> delegate.deleteDocument(indexName, documentId, refresh));
    }

    @Override
    public CompletableFuture<BulkOperationResult> bulkIndex(String indexName, List<? extends Map<String, ?>> documents,
                                                            boolean refresh, int batchSize) {
        return submit(() -> delegate.bulkIndex(indexName, documents, refresh, batchSize));
    }

    @Override
    public CompletableFuture<BulkOperationResult> bulkUpdate(String indexName, List<? extends Map<String, ?>> updates,
                                                             boolean refresh) {
        return submit(() -> delegate.bulkUpdate(indexName, updates, refresh));
    }

    @Override
    public CompletableFuture<BulkOperationResult> bulkDelete(String indexName, List<String> documentIds,
                                                             boolean refresh) {
        return submit(() -> delegate.bulkDelete(indexName, documentIds, refresh));
    }

    @Override
    public CompletableFuture<SearchResult> productSearch(ProductSearchRequest request) {
        return submit(() -> delegate.productSearch(request));
    }

    @Override
    public CompletableFuture<List<String>> autocomplete(String indexName, String field, String prefix, int size) {
        return submit(() -> delegate.autocomplete(indexName, field, prefix, size));
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> moreLikeThis(String indexName, String documentId,
                                                                     List<String> fields, int maxResults) {
        return submit(() -> delegate.moreLikeThis(indexName, documentId, fields, maxResults));
    }

    @Override
    public CompletableFuture<Boolean> createIndex(String indexName, Map<String, Object> mappings,
                                                  Map<String, Object> settings, Map<String, Object> aliases) {
        return submit(() -> delegate.createIndex(indexName, mappings, settings, aliases));
    }

    @Override
    public CompletableFuture<Boolean> deleteIndex(String indexName) {
        return submit(() -> delegate.deleteIndex(indexName));
    }

    @Override
    public CompletableFuture<Boolean> indexExists(String indexName) {
        return submit(() -> delegate.indexExists(indexName));
    }

    @Override
    public CompletableFuture<Map<String, Object>> getIndexSettings(String indexName) {
        return submit(() -> delegate.getIndexSettings(indexName));
    }

    @Override
    public CompletableFuture<Boolean> updateIndexSettings(String indexName, Map<String, Object> settings) {
        return submit(() -> delegate.updateIndexSettings(indexName, settings));
    }

    @Override
    public CompletableFuture<Boolean> refreshIndex(String indexName) {
        return submit(() -> delegate.refreshIndex(indexName));
    }

    @Override
    public CompletableFuture<Boolean> flushIndex(String indexName) {
        return submit(() -> delegate.flushIndex(indexName));
    }

    @Override
    public CompletableFuture<Map<String, Object>> getIndexStats(String indexName) {
        return submit(() -> delegate.getIndexStats(indexName));
    }

    @Override
    public CompletableFuture<Map<String, Object>> clusterHealth() {
        return submit(delegate::clusterHealth);
    }

    @Override
    public CompletableFuture<ConnectionStatus> testConnection() {
        return submit(delegate::testConnection);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                Logger.logWarn("[OpenSearch] Async workers did not stop within 5s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            delegate.close();
        }
    }
}
