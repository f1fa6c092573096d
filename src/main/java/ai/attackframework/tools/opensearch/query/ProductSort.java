package ai.attackframework.tools.opensearch.query;

import java.util.List;
import java.util.Locale;

import ai.attackframework.tools.opensearch.model.SortOption;
import ai.attackframework.tools.opensearch.model.SortOrder;

/**
 * Named sort modes for product listings. Unknown keys fall back to {@link #RELEVANCE}.
 */
public enum ProductSort {
    RELEVANCE(null, null),
    PRICE_ASC("price", SortOrder.ASC),
    PRICE_DESC("price", SortOrder.DESC),
    NEWEST("created_at", SortOrder.DESC),
    POPULAR("view_count", SortOrder.DESC),
    RATING("average_rating", SortOrder.DESC);

    private final String field;
    private final SortOrder order;

    ProductSort(String field, SortOrder order) {
        this.field = field;
        this.order = order;
    }

    public static ProductSort fromKey(String key) {
        if (key == null) {
            return RELEVANCE;
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        for (ProductSort s : values()) {
            if (s.name().equals(normalized)) {
                return s;
            }
        }
        return RELEVANCE;
    }

    /** Sort clauses; empty for relevance (score order). */
    public List<SortOption> sortOptions() {
        return field == null ? List.of() : List.of(new SortOption(field, order));
    }
}
