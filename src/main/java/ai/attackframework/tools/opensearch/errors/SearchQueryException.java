package ai.attackframework.tools.opensearch.errors;

import java.util.Map;

/** Invalid query DSL or a query the cluster rejected. */
public class SearchQueryException extends OpenSearchOperationException {

    private final Map<String, Object> query;

    public SearchQueryException(String message) {
        this(message, null, null);
    }

    public SearchQueryException(String message, Map<String, Object> query, Throwable originalError) {
        super("Search query error: " + message, originalError);
        this.query = query == null ? null : Map.copyOf(query);
    }

    /** Offending query, when known. */
    public Map<String, Object> query() {
        return query;
    }
}
