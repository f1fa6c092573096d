package ai.attackframework.tools.opensearch.bulk;

import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;

/**
 * Approximate NDJSON size of bulk actions, used to close a batch before it exceeds
 * {@code maxBatchBytes}. Counts quotes, colons and commas; ignores JSON escaping.
 */
public final class BulkPayloadEstimator {

    private static final int NUMBER_BYTES = 20;
    private static final int TEMPORAL_BYTES = 32;

    private BulkPayloadEstimator() {}

    /** Metadata line, source line for index/update, and the trailing newlines. */
    public static long estimateAction(BulkAction action) {
        // {"<op>":{"_index":"<index>","_id":"<id>"}}\n
        long bytes = 2 + quoted(action.type().key()) + 1 + 2 + quoted("_index") + 1 + quoted(action.index()) + 1;
        if (action.id() != null) {
            bytes += 1 + quoted("_id") + 1 + quoted(action.id());
        }
        return switch (action.type()) {
            case DELETE -> bytes;
            // {"doc":{...}}\n
            case UPDATE -> bytes + 2 + quoted("doc") + 1 + estimateSource(action.source()) + 1;
            case INDEX -> bytes + estimateSource(action.source()) + 1;
        };
    }

    /** Size of {@code source} as a JSON object; {@code 0} for {@code null}. */
    public static long estimateSource(Map<String, ?> source) {
        return source == null ? 0 : value(source);
    }

    private static long value(Object v) {
        if (v == null) {
            return 4;
        }
        if (v instanceof CharSequence s) {
            return quoted(s.toString());
        }
        if (v instanceof Number) {
            return NUMBER_BYTES;
        }
        if (v instanceof Boolean b) {
            return b ? 4 : 5;
        }
        if (v instanceof TemporalAccessor) {
            return TEMPORAL_BYTES;
        }
        if (v instanceof Enum<?> e) {
            return quoted(e.name());
        }
        if (v instanceof Map<?, ?> map) {
            long sum = 2 + Math.max(0, map.size() - 1);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                sum += quoted(String.valueOf(e.getKey())) + 1 + value(e.getValue());
            }
            return sum;
        }
        if (v instanceof Collection<?> items) {
            long sum = 2 + Math.max(0, items.size() - 1);
            for (Object item : items) {
                sum += value(item);
            }
            return sum;
        }
        return quoted(v.toString());
    }

    private static long quoted(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length + 2L;
    }
}
