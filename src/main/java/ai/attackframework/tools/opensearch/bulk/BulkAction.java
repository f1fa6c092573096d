package ai.attackframework.tools.opensearch.bulk;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One line of a bulk request.
 *
 * @param type   operation
 * @param index  target index
 * @param id     document id; may be {@code null} for {@link Type#INDEX} (server-generated)
 * @param source full document for INDEX, partial document for UPDATE, {@code null} for DELETE
 */
public record BulkAction(Type type, String index, String id, Map<String, Object> source) {

    public enum Type {
        INDEX, UPDATE, DELETE;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public BulkAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(index, "index");
    }

    public static BulkAction index(String index, String id, Map<String, Object> source) {
        return new BulkAction(Type.INDEX, index, id, source);
    }

    public static BulkAction update(String index, String id, Map<String, Object> partial) {
        return new BulkAction(Type.UPDATE, index, Objects.requireNonNull(id, "id"), partial);
    }

    public static BulkAction delete(String index, String id) {
        return new BulkAction(Type.DELETE, index, Objects.requireNonNull(id, "id"), null);
    }

    /** Approximate wire size of this action's NDJSON lines. */
    public long estimatedBytes() {
        return BulkPayloadEstimator.estimateAction(this);
    }
}
