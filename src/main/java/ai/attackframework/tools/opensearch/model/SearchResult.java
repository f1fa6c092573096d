package ai.attackframework.tools.opensearch.model;

import java.util.List;
import java.util.Map;

/**
 * Flattened search response.
 *
 * @param hits         {@code _source} of each hit plus {@code _id}, {@code _index}, {@code _score}
 *                     and {@code highlight} when present
 * @param total        total hit count
 * @param tookMs       server-side time
 * @param aggregations aggregation results as plain maps, empty when none were requested
 * @param scrollId     scroll cursor, {@code null} unless scrolling
 * @param shards       shard statistics
 */
public record SearchResult(List<Map<String, Object>> hits, long total, long tookMs,
                           Map<String, Object> aggregations, String scrollId, Map<String, Object> shards) {

    public SearchResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
        aggregations = aggregations == null ? Map.of() : aggregations;
        shards = shards == null ? Map.of() : shards;
    }

    public boolean hasHits() {
        return !hits.isEmpty();
    }

    /** Number of pages at {@code perPage}; 1 when there are no hits. */
    public int pageCount(int perPage) {
        if (total == 0 || perPage <= 0) {
            return 1;
        }
        return (int) ((total + perPage - 1) / perPage);
    }
}
