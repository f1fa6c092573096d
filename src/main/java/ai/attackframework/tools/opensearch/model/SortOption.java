package ai.attackframework.tools.opensearch.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One sort clause.
 *
 * @param field   field to sort on
 * @param order   direction, ascending when {@code null}
 * @param missing placement of documents without the field ({@code _first}/{@code _last}), optional
 */
public record SortOption(String field, SortOrder order, String missing) {

    public SortOption {
        Objects.requireNonNull(field, "field");
        order = order == null ? SortOrder.ASC : order;
    }

    public SortOption(String field, SortOrder order) {
        this(field, order, null);
    }

    /** {@code {field: {order, missing?}}}. */
    public Map<String, Object> toDsl() {
        Map<String, Object> opts = new LinkedHashMap<>();
        opts.put("order", order.jsonValue());
        if (missing != null) {
            opts.put("missing", missing);
        }
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put(field, opts);
        return dsl;
    }
}
