package ai.attackframework.tools.opensearch.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Thread-safe operation statistics per index, plus a short cluster-health history.
 *
 * <p>Session-scoped: nothing is persisted. Durations are milliseconds. Index entries with no
 * search/index/bulk activity inside the retention window are dropped by an hourly sweep that
 * runs on the recording path.</p>
 */
public final class OpenSearchStats {

    private static final int HEALTH_HISTORY_LIMIT = 100;
    private static final Duration CLEANUP_INTERVAL = Duration.ofHours(1);

    private final Clock clock;
    private final Duration retention;
    private final Map<String, OperationMetrics> stats = new LinkedHashMap<>();
    private final List<Map<String, Object>> clusterStatusHistory = new ArrayList<>();

    private Instant startTime;
    private Instant lastCleanup;
    private long clusterHealthChecks;
    private Map<String, Object> lastClusterHealth;

    public OpenSearchStats() {
        this(Duration.ofHours(OpenSearchDefaults.STATS_RETENTION_HOURS), Clock.systemUTC());
    }

    public OpenSearchStats(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
        this.startTime = clock.instant();
        this.lastCleanup = startTime;
    }

    /** Single-document or search operation. */
    public void recordOperation(OperationType type, String indexName, double durationMs, boolean success) {
        recordOperation(type, indexName, durationMs, success, 1, success ? 1 : 0, success ? 0 : 1);
    }

    /**
     * Records one operation.
     *
     * @param docCount     documents touched
     * @param successCount for bulk: documents that succeeded
     * @param errorCount   for bulk: documents that failed; any failure counts the bulk as an error
     */
    public synchronized void recordOperation(OperationType type, String indexName, double durationMs, boolean success,
                                             int docCount, int successCount, int errorCount) {
        autoCleanup();
        OperationMetrics metrics = stats.computeIfAbsent(indexName, k -> new OperationMetrics());
        boolean error = type == OperationType.BULK ? errorCount > 0 : !success;
        metrics.counter(type).record(durationMs, error, clock.instant());
    }

    /** Stores a cluster health response and appends a condensed entry to the history. */
    public synchronized void recordClusterHealth(Map<String, Object> health) {
        clusterHealthChecks++;
        lastClusterHealth = health;
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", clock.instant().toString());
        entry.put("status", health.get("status"));
        entry.put("nodes", health.get("number_of_nodes"));
        entry.put("data_nodes", health.get("number_of_data_nodes"));
        entry.put("active_shards", health.get("active_shards"));
        entry.put("unassigned_shards", health.get("unassigned_shards"));
        clusterStatusHistory.add(entry);
        while (clusterStatusHistory.size() > HEALTH_HISTORY_LIMIT) {
            clusterStatusHistory.remove(0);
        }
    }

    private void autoCleanup() {
        Instant now = clock.instant();
        if (Duration.between(lastCleanup, now).compareTo(CLEANUP_INTERVAL) < 0) {
            return;
        }
        Instant cutoff = now.minus(retention);
        stats.entrySet().removeIf(e -> e.getValue().lastActivity().isBefore(cutoff));
        lastCleanup = now;
    }

    /** Nested map: search/index/bulk/update/delete to their counters. Zeros for unknown indexes. */
    public synchronized Map<String, Object> getIndexStats(String indexName) {
        OperationMetrics m = stats.get(indexName);
        return (m == null ? new OperationMetrics() : m).snapshot();
    }

    public synchronized Map<String, Map<String, Object>> getAllStats() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        stats.forEach((k, v) -> out.put(k, v.snapshot()));
        return out;
    }

    /** Totals over search, index and bulk across all indexes. */
    public synchronized Map<String, Object> getPerformanceSummary() {
        long totalOps = 0;
        long totalErrors = 0;
        double searchTime = 0;
        double indexTime = 0;
        double bulkTime = 0;
        for (OperationMetrics m : stats.values()) {
            totalOps += m.search.count + m.index.count + m.bulk.count;
            totalErrors += m.search.errors + m.index.errors + m.bulk.errors;
            searchTime += m.search.totalTimeMs;
            indexTime += m.index.totalTimeMs;
            bulkTime += m.bulk.totalTimeMs;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_indices", stats.size());
        out.put("total_operations", totalOps);
        out.put("total_search_time", searchTime);
        out.put("total_index_time", indexTime);
        out.put("total_bulk_time", bulkTime);
        out.put("avg_search_time", stats.isEmpty() ? 0.0 : searchTime / stats.size());
        out.put("total_errors", totalErrors);
        out.put("error_rate_percent", totalOps > 0 ? totalErrors * 100.0 / totalOps : 0.0);
        out.put("cluster_health_checks", clusterHealthChecks);
        out.put("uptime_hours", Duration.between(startTime, clock.instant()).toMillis() / 3_600_000.0);
        return out;
    }

    /** Indexes ordered by slowest single search, descending. */
    public synchronized List<Map<String, Object>> getSlowQueries(int limit) {
        List<Map<String, Object>> out = new ArrayList<>();
        stats.forEach((index, m) -> {
            if (m.search.hasSamples() && m.search.maxTimeMs() > 0) {
                Map<String, Object> e = new LinkedHashMap<>();
                e.put("index", index);
                e.put("max_time", m.search.maxTimeMs());
                e.put("avg_time", m.search.avgTimeMs());
                e.put("p95_time", m.search.p95());
                e.put("count", m.search.count);
                e.put("success_rate", m.search.successRate());
                out.add(e);
            }
        });
        out.sort(Comparator.comparingDouble((Map<String, Object> e) -> (Double) e.get("max_time")).reversed());
        int n = Math.max(0, limit);
        return out.size() > n ? new ArrayList<>(out.subList(0, n)) : out;
    }

    /** Most recent {@code limit} health entries, oldest first. */
    public synchronized List<Map<String, Object>> getClusterStatusHistory(int limit) {
        int from = Math.max(0, clusterStatusHistory.size() - Math.max(0, limit));
        return new ArrayList<>(clusterStatusHistory.subList(from, clusterStatusHistory.size()));
    }

    public synchronized Map<String, Object> getLastClusterHealth() {
        return lastClusterHealth;
    }

    public synchronized void reset() {
        stats.clear();
        startTime = clock.instant();
        lastCleanup = startTime;
        clusterHealthChecks = 0;
        lastClusterHealth = null;
        clusterStatusHistory.clear();
    }
}
