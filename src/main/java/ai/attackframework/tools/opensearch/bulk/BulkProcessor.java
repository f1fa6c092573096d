package ai.attackframework.tools.opensearch.bulk;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import ai.attackframework.tools.opensearch.errors.ValidationException;
import ai.attackframework.tools.opensearch.model.BulkOperationResult;
import ai.attackframework.tools.opensearch.utils.Logger;
import ai.attackframework.tools.opensearch.utils.OpenSearchUtils;
import ai.attackframework.tools.opensearch.utils.RetryHandler;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.ErrorCause;
import org.opensearch.client.opensearch.core.BulkRequest;
import org.opensearch.client.opensearch.core.BulkResponse;
import org.opensearch.client.opensearch.core.bulk.BulkResponseItem;

/**
 * Batched bulk indexing, update and delete with per-batch retries.
 *
 * <p>Batches close on action count or estimated payload bytes. When a batch comes back with
 * item errors and at least one of them is transient, only the failed actions are resent after
 * {@code retryDelay * 2^attempt}. Actions that still fail transiently after the last attempt are
 * parked in a bounded per-index {@link RetryQueue} and can be resent with
 * {@link #drainRetryQueue(String)}.</p>
 *
 * <p>Results are per call; counters in {@link #getStats()} are cumulative and thread-safe.</p>
 */
public final class BulkProcessor {

    static final List<String> RETRYABLE_ITEM_ERRORS = List.of(
            "version_conflict", "document_missing", "cluster_block", "circuit_breaking",
            "429", "503", "timeout", "connection");

    private final OpenSearchClient client;
    private final int batchSize;
    private final int maxRetries;
    private final long retryDelayMs;
    private final boolean refreshAfterBatch;
    private final long maxBatchBytes;
    private final RetryQueue retryQueue;

    private final AtomicLong totalBatches = new AtomicLong();
    private final AtomicLong totalDocuments = new AtomicLong();
    private final AtomicLong successfulBatches = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();

    private BulkProcessor(Builder b) {
        this.client = b.client;
        this.batchSize = b.batchSize;
        this.maxRetries = b.maxRetries;
        this.retryDelayMs = b.retryDelayMs;
        this.refreshAfterBatch = b.refreshAfterBatch;
        this.maxBatchBytes = b.maxBatchBytes;
        this.retryQueue = b.retryQueue != null ? b.retryQueue : new RetryQueue(OpenSearchDefaults.RETRY_QUEUE_CAPACITY);
    }

    public static Builder builder(OpenSearchClient client) {
        return new Builder(client);
    }

    /**
     * Indexes documents. The id comes from {@code idField} when given and present, otherwise from an
     * {@code _id} key, which is removed from the source.
     */
    public BulkOperationResult processBulkIndex(String indexName, List<? extends Map<String, ?>> documents,
                                                String idField) {
        if (documents == null || documents.isEmpty()) {
            return new BulkOperationResult();
        }
        totalDocuments.addAndGet(documents.size());
        List<BulkAction> actions = new ArrayList<>(documents.size());
        for (Map<String, ?> doc : documents) {
            Map<String, Object> source = new LinkedHashMap<>(doc);
            String id = null;
            if (idField != null && source.get(idField) != null) {
                id = String.valueOf(source.get(idField));
            } else if (source.containsKey("_id")) {
                Object raw = source.remove("_id");
                id = raw == null ? null : String.valueOf(raw);
            }
            actions.add(BulkAction.index(indexName, id, OpenSearchUtils.normalizeDocument(source)));
        }
        return processBatches(indexName, actions);
    }

    public BulkOperationResult processBulkUpdate(String indexName, List<? extends Map<String, ?>> updates) {
        return processBulkUpdate(indexName, updates, "_id");
    }

    /**
     * Partial-document updates.
     *
     * @throws ValidationException when an update lacks {@code idField}
     */
    public BulkOperationResult processBulkUpdate(String indexName, List<? extends Map<String, ?>> updates,
                                                 String idField) {
        if (updates == null || updates.isEmpty()) {
            return new BulkOperationResult();
        }
        List<BulkAction> actions = new ArrayList<>(updates.size());
        for (Map<String, ?> update : updates) {
            Object id = update.get(idField);
            if (id == null) {
                throw new ValidationException("Document missing " + idField + " field");
            }
            Map<String, Object> partial = new LinkedHashMap<>(update);
            partial.remove(idField);
            actions.add(BulkAction.update(indexName, String.valueOf(id), OpenSearchUtils.normalizeDocument(partial)));
        }
        totalDocuments.addAndGet(updates.size());
        return processBatches(indexName, actions);
    }

    public BulkOperationResult processBulkDelete(String indexName, List<String> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return new BulkOperationResult();
        }
        totalDocuments.addAndGet(documentIds.size());
        List<BulkAction> actions = new ArrayList<>(documentIds.size());
        for (String id : documentIds) {
            actions.add(BulkAction.delete(indexName, id));
        }
        return processBatches(indexName, actions);
    }

    /**
     * Resends up to {@value OpenSearchDefaults#RETRY_DRAIN_BATCH_SIZE} queued actions for the
     * index. Actions that fail transiently again go back to the queue.
     */
    public BulkOperationResult drainRetryQueue(String indexName) {
        List<BulkAction> actions = retryQueue.pollBatch(indexName, OpenSearchDefaults.RETRY_DRAIN_BATCH_SIZE);
        if (actions.isEmpty()) {
            return new BulkOperationResult();
        }
        Logger.logInfo("[OpenSearch] Draining " + actions.size() + " queued actions for index " + indexName);
        return processBatches(indexName, actions);
    }

    /** Number of actions parked for the index. */
    public int queuedCount(String indexName) {
        return retryQueue.size(indexName);
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_batches", totalBatches.get());
        stats.put("total_documents", totalDocuments.get());
        stats.put("successful_batches", successfulBatches.get());
        stats.put("failed_batches", failedBatches.get());
        stats.put("total_retries", totalRetries.get());
        stats.put("total_errors", totalErrors.get());
        stats.put("queued_actions", retryQueue.totalSize());
        stats.put("dropped_actions", retryQueue.totalDropped());
        stats.put("batch_size", batchSize);
        stats.put("max_retries", maxRetries);
        stats.put("retry_delay_ms", retryDelayMs);
        stats.put("refresh_after_batch", refreshAfterBatch);
        stats.put("max_batch_bytes", maxBatchBytes);
        return stats;
    }

    public void resetStats() {
        totalBatches.set(0);
        totalDocuments.set(0);
        successfulBatches.set(0);
        failedBatches.set(0);
        totalRetries.set(0);
        totalErrors.set(0);
    }

    private BulkOperationResult processBatches(String indexName, List<BulkAction> actions) {
        List<BulkBatch> batches = BulkBatch.split(indexName, actions, batchSize, maxBatchBytes);
        Logger.logInfo("[OpenSearch] Processing " + batches.size() + " batches with up to "
                + batchSize + " documents each for index " + indexName);

        BulkOperationResult result = new BulkOperationResult();
        int i = 0;
        for (BulkBatch batch : batches) {
            i++;
            totalBatches.incrementAndGet();
            Logger.logDebug("[OpenSearch] Processing batch " + i + "/" + batches.size() + " for index " + indexName);

            BulkOperationResult batchResult = processBatchWithRetry(batch);
            result.merge(batchResult);

            if (batchResult.hasErrors()) {
                failedBatches.incrementAndGet();
                totalErrors.addAndGet(batchResult.failed());
            } else {
                successfulBatches.incrementAndGet();
                if (refreshAfterBatch) {
                    refresh(indexName);
                }
            }
        }
        result.setTotal(actions.size());
        Logger.logInfo("[OpenSearch] Bulk processing completed: " + result.successful() + " successful, "
                + result.failed() + " failed, took " + result.tookMs() + "ms");
        return result;
    }

    private BulkOperationResult processBatchWithRetry(BulkBatch batch) {
        BulkOperationResult result = new BulkOperationResult(batch.size());
        long start = System.nanoTime();
        int attempts = Math.max(1, maxRetries);
        List<BulkAction> pending = batch.actions();
        List<BulkAction> toQueue = new ArrayList<>();

        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                totalRetries.incrementAndGet();
                batch.retryCount(attempt);
            }
            try {
                BulkResponse response = client.bulk(buildRequest(pending));
                List<BulkAction> failedActions = new ArrayList<>();
                List<Map<String, Object>> failedErrors = new ArrayList<>();
                List<BulkResponseItem> items = response.items();
                for (int k = 0; k < items.size() && k < pending.size(); k++) {
                    BulkResponseItem item = items.get(k);
                    if (item.error() == null) {
                        result.addSuccessful(1);
                    } else {
                        failedActions.add(pending.get(k));
                        failedErrors.add(itemError(pending.get(k), item));
                    }
                }
                if (failedActions.isEmpty()) {
                    Logger.logDebug("[OpenSearch] Batch completed successfully (attempt " + (attempt + 1) + ")");
                    break;
                }
                Logger.logWarn("[OpenSearch] Batch completed with " + failedActions.size() + " errors (attempt "
                        + (attempt + 1) + "/" + attempts + ")");

                boolean retryable = failedErrors.stream().anyMatch(BulkProcessor::isRetryableItemError);
                if (retryable && attempt < attempts - 1) {
                    pending = failedActions;
                    long wait = retryDelayMs * (1L << attempt);
                    Logger.logInfo("[OpenSearch] Retrying " + pending.size() + " actions in " + wait + "ms");
                    if (!sleep(wait)) {
                        result.addFailures(pending.size(), Map.of("batch_error", "interrupted"));
                        break;
                    }
                    continue;
                }
                for (int k = 0; k < failedActions.size(); k++) {
                    result.addError(failedErrors.get(k));
                    if (isRetryableItemError(failedErrors.get(k))) {
                        toQueue.add(failedActions.get(k));
                    }
                }
                break;
            } catch (IOException | RuntimeException e) {
                String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                Logger.logError("[OpenSearch] Batch processing failed on attempt " + (attempt + 1) + ": " + msg);
                if (attempt == attempts - 1) {
                    result.addFailures(pending.size(), Map.of("batch_error", msg));
                    if (RetryHandler.shouldRetry(e)) {
                        toQueue.addAll(pending);
                    }
                    break;
                }
                if (!sleep(retryDelayMs * (1L << attempt))) {
                    result.addFailures(pending.size(), Map.of("batch_error", msg));
                    break;
                }
            }
        }
        result.addTook((System.nanoTime() - start) / 1_000_000);
        enqueue(batch.indexName(), toQueue);
        return result;
    }

    private void enqueue(String indexName, List<BulkAction> actions) {
        if (actions.isEmpty()) {
            return;
        }
        int added = retryQueue.offerAll(indexName, actions);
        if (added < actions.size()) {
            Logger.logError("[OpenSearch] Retry queue full for index " + indexName + "; dropping "
                    + (actions.size() - added) + " actions.");
        }
        if (added > 0) {
            Logger.logWarn("[OpenSearch] Queued " + added + " actions for later retry on index " + indexName);
        }
    }

    private void refresh(String indexName) {
        try {
            client.indices().refresh(r -> r.index(indexName));
        } catch (IOException | RuntimeException e) {
            Logger.logWarn("[OpenSearch] Failed to refresh index " + indexName + ": " + e.getMessage());
        }
    }

    static BulkRequest buildRequest(List<BulkAction> actions) {
        BulkRequest.Builder builder = new BulkRequest.Builder();
        for (BulkAction a : actions) {
            switch (a.type()) {
                case INDEX:
                    builder.operations(o -> o.index(i -> {
                        i.index(a.index()).document(a.source());
                        if (a.id() != null) {
                            i.id(a.id());
                        }
                        return i;
                    }));
                    break;
                case UPDATE:
                    builder.operations(o -> o.update(u -> u.index(a.index()).id(a.id()).document(a.source())));
                    break;
                case DELETE:
                    builder.operations(o -> o.delete(d -> d.index(a.index()).id(a.id())));
                    break;
                default:
                    throw new IllegalStateException("Unknown bulk action: " + a.type());
            }
        }
        return builder.build();
    }

    private static Map<String, Object> itemError(BulkAction action, BulkResponseItem item) {
        ErrorCause cause = item.error();
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", cause.type());
        error.put("reason", cause.reason());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("op", action.type().key());
        entry.put("index", action.index());
        entry.put("id", item.id() != null ? item.id() : action.id());
        entry.put("status", item.status());
        entry.put("error", error);
        return entry;
    }

    /** True when the item error type/reason or status marks a transient failure. */
    @SuppressWarnings("unchecked")
    static boolean isRetryableItemError(Map<String, Object> entry) {
        Object err = entry.get("error");
        StringBuilder text = new StringBuilder(String.valueOf(entry.get("status")));
        if (err instanceof Map<?, ?> m) {
            Map<String, Object> e = (Map<String, Object>) m;
            text.append(' ').append(e.get("type")).append(' ').append(e.get("reason"));
        }
        String probe = text.toString().toLowerCase(Locale.ROOT);
        for (String marker : RETRYABLE_ITEM_ERRORS) {
            if (probe.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Builder; defaults come from {@link OpenSearchDefaults}. */
    public static final class Builder {
        private final OpenSearchClient client;
        private int batchSize = OpenSearchDefaults.BULK_BATCH_SIZE;
        private int maxRetries = OpenSearchDefaults.BULK_RETRY_ATTEMPTS;
        private long retryDelayMs = OpenSearchDefaults.BULK_RETRY_DELAY_MS;
        private boolean refreshAfterBatch;
        private long maxBatchBytes = OpenSearchDefaults.MAX_BULK_BATCH_BYTES;
        private RetryQueue retryQueue;

        private Builder(OpenSearchClient client) {
            this.client = client;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new ValidationException("Chunk size must be positive");
            }
            this.batchSize = Math.min(batchSize, OpenSearchDefaults.MAX_BULK_BATCH_SIZE);
            return this;
        }

        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; return this; }
        public Builder refreshAfterBatch(boolean refresh) { this.refreshAfterBatch = refresh; return this; }
        public Builder maxBatchBytes(long maxBatchBytes) { this.maxBatchBytes = maxBatchBytes; return this; }
        public Builder retryQueue(RetryQueue retryQueue) { this.retryQueue = retryQueue; return this; }

        public BulkProcessor build() {
            return new BulkProcessor(this);
        }
    }
}
