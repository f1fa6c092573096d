package ai.attackframework.tools.opensearch.stats;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-index counters and timings, in milliseconds.
 *
 * <p>Not thread-safe on its own; {@link OpenSearchStats} serializes access.</p>
 */
final class OperationMetrics {

    static final int SAMPLE_WINDOW = 1000;

    final Counter search = new Counter(true);
    final Counter index = new Counter(true);
    final Counter bulk = new Counter(true);
    final Counter update = new Counter(false);
    final Counter delete = new Counter(false);

    Counter counter(OperationType type) {
        switch (type) {
            case SEARCH: return search;
            case INDEX: return index;
            case BULK: return bulk;
            case UPDATE: return update;
            case DELETE: return delete;
            default: throw new IllegalArgumentException("Unknown operation type: " + type);
        }
    }

    /** Latest of the tracked last-executed times, or {@link Instant#MIN}. */
    Instant lastActivity() {
        Instant latest = Instant.MIN;
        for (Counter c : List.of(search, index, bulk)) {
            if (c.lastExecuted != null && c.lastExecuted.isAfter(latest)) {
                latest = c.lastExecuted;
            }
        }
        return latest;
    }

    Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("search", search.snapshot());
        out.put("index", index.snapshot());
        out.put("bulk", bulk.snapshot());
        out.put("update", update.snapshot());
        out.put("delete", delete.snapshot());
        return out;
    }

    static final class Counter {
        private final boolean detailed;
        long count;
        double totalTimeMs;
        long errors;
        Instant lastExecuted;
        private final Deque<Double> samples = new ArrayDeque<>();

        Counter(boolean detailed) {
            this.detailed = detailed;
        }

        void record(double timeMs, boolean error, Instant now) {
            count++;
            totalTimeMs += timeMs;
            if (error) {
                errors++;
            }
            if (detailed) {
                lastExecuted = now;
                samples.addLast(timeMs);
                while (samples.size() > SAMPLE_WINDOW) {
                    samples.removeFirst();
                }
            }
        }

        double avgTimeMs() {
            return count == 0 ? 0.0 : totalTimeMs / count;
        }

        double p95() {
            return p95(new ArrayList<>(samples));
        }

        double maxTimeMs() {
            return samples.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }

        boolean hasSamples() {
            return !samples.isEmpty();
        }

        double successRate() {
            if (count == 0) {
                return 100.0;
            }
            return (count - errors) * 100.0 / count;
        }

        Map<String, Object> snapshot() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("count", count);
            m.put("total_time", totalTimeMs);
            if (detailed) {
                m.put("avg_time", avgTimeMs());
                m.put("p95_time", p95());
            }
            m.put("errors", errors);
            if (detailed) {
                m.put("success_rate", successRate());
                m.put("last_executed", lastExecuted == null ? null : lastExecuted.toString());
            }
            return m;
        }

        /**
         * 95th percentile: 19th of 20 cut points, exclusive method with linear interpolation.
         */
        static double p95(List<Double> values) {
            if (values.isEmpty()) {
                return 0.0;
            }
            if (values.size() == 1) {
                return values.get(0);
            }
            List<Double> data = new ArrayList<>(values);
            Collections.sort(data);
            int n = 20;
            int ld = data.size();
            int m = ld + 1;
            int i = 19;
            int j = i * m / n;
            j = Math.max(1, Math.min(ld - 1, j));
            int delta = i * m - j * n;
            return (data.get(j - 1) * (n - delta) + data.get(j) * delta) / n;
        }
    }
}
