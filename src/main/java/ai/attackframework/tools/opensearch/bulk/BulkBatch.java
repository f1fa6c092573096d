package ai.attackframework.tools.opensearch.bulk;

import java.util.ArrayList;
import java.util.List;

/**
 * Actions sent in one bulk request, with the number of retries spent on them.
 */
final class BulkBatch {

    private final String indexName;
    private final List<BulkAction> actions;
    private int retryCount;

    BulkBatch(String indexName, List<BulkAction> actions) {
        this.indexName = indexName;
        this.actions = new ArrayList<>(actions);
    }

    String indexName() { return indexName; }
    List<BulkAction> actions() { return actions; }
    int size() { return actions.size(); }
    int retryCount() { return retryCount; }
    void retryCount(int retryCount) { this.retryCount = retryCount; }

    /**
     * Splits actions into batches bounded by count and by estimated payload bytes, whichever
     * is reached first. A single oversize action still forms its own batch.
     */
    static List<BulkBatch> split(String indexName, List<BulkAction> actions, int maxActions, long maxBytes) {
        List<BulkBatch> batches = new ArrayList<>();
        List<BulkAction> current = new ArrayList<>();
        long currentBytes = 0;
        for (BulkAction a : actions) {
            long bytes = a.estimatedBytes();
            if (!current.isEmpty() && (current.size() >= maxActions || currentBytes + bytes > maxBytes)) {
                batches.add(new BulkBatch(indexName, current));
                current = new ArrayList<>();
                currentBytes = 0;
            }
            current.add(a);
            currentBytes += bytes;
        }
        if (!current.isEmpty()) {
            batches.add(new BulkBatch(indexName, current));
        }
        return batches;
    }
}
