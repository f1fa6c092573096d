package ai.attackframework.tools.opensearch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Search request parameters. Immutable; created with {@link #builder()}.
 *
 * <p>{@code sort} entries may be field names, {@link SortOption}s or raw DSL maps.
 * {@code source} is a {@link Boolean} or a list of field names.</p>
 */
public final class SearchQuery {

    private final Map<String, Object> query;
    private final int size;
    private final int from;
    private final List<Object> sort;
    private final Map<String, Object> aggs;
    private final Map<String, Object> highlight;
    private final Object source;
    private final Map<String, Object> scriptFields;
    private final boolean trackScores;
    private final boolean explain;
    private final boolean version;
    private final SearchType searchType;

    private SearchQuery(Builder b) {
        this.query = b.query;
        this.size = b.size;
        this.from = b.from;
        this.sort = b.sort == null ? null : Collections.unmodifiableList(new ArrayList<>(b.sort));
        this.aggs = b.aggs;
        this.highlight = b.highlight;
        this.source = b.source;
        this.scriptFields = b.scriptFields;
        this.trackScores = b.trackScores;
        this.explain = b.explain;
        this.version = b.version;
        this.searchType = b.searchType;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy with a different size, used to enforce the result window. */
    public SearchQuery withSize(int newSize) {
        return toBuilder().size(newSize).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.query = query;
        b.size = size;
        b.from = from;
        b.sort = sort == null ? null : new ArrayList<>(sort);
        b.aggs = aggs;
        b.highlight = highlight;
        b.source = source;
        b.scriptFields = scriptFields;
        b.trackScores = trackScores;
        b.explain = explain;
        b.version = version;
        b.searchType = searchType;
        return b;
    }

    public Map<String, Object> query() { return query; }
    public int size() { return size; }
    public int from() { return from; }
    public List<Object> sort() { return sort; }
    public Map<String, Object> aggs() { return aggs; }
    public Map<String, Object> highlight() { return highlight; }
    public Object source() { return source; }
    public Map<String, Object> scriptFields() { return scriptFields; }
    public boolean trackScores() { return trackScores; }
    public boolean explain() { return explain; }
    public boolean version() { return version; }
    public SearchType searchType() { return searchType; }

    /**
     * Request body as a DSL map. {@code size} is emitted only when it differs from the default page
     * size, {@code from} only when positive; booleans only when true.
     */
    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (query != null) {
            body.put("query", query);
        }
        if (size != OpenSearchDefaults.PAGE_SIZE) {
            body.put("size", size);
        }
        if (from > 0) {
            body.put("from", from);
        }
        if (sort != null && !sort.isEmpty()) {
            List<Object> rendered = new ArrayList<>();
            for (Object s : sort) {
                rendered.add(s instanceof SortOption so ? so.toDsl() : s);
            }
            body.put("sort", rendered);
        }
        if (aggs != null) {
            body.put("aggs", aggs);
        }
        if (highlight != null) {
            body.put("highlight", highlight);
        }
        if (source != null) {
            body.put("_source", source);
        }
        if (scriptFields != null) {
            body.put("script_fields", scriptFields);
        }
        if (trackScores) {
            body.put("track_scores", true);
        }
        if (explain) {
            body.put("explain", true);
        }
        if (version) {
            body.put("version", true);
        }
        return body;
    }

    public static final class Builder {
        private Map<String, Object> query;
        private int size = OpenSearchDefaults.PAGE_SIZE;
        private int from;
        private List<Object> sort;
        private Map<String, Object> aggs;
        private Map<String, Object> highlight;
        private Object source;
        private Map<String, Object> scriptFields;
        private boolean trackScores;
        private boolean explain;
        private boolean version;
        private SearchType searchType = SearchType.QUERY_THEN_FETCH;

        private Builder() {}

        public Builder query(Map<String, Object> query) { this.query = query; return this; }
        public Builder size(int size) { this.size = size; return this; }
        public Builder from(int from) { this.from = from; return this; }
        public Builder aggs(Map<String, Object> aggs) { this.aggs = aggs; return this; }
        public Builder highlight(Map<String, Object> highlight) { this.highlight = highlight; return this; }
        public Builder scriptFields(Map<String, Object> scriptFields) { this.scriptFields = scriptFields; return this; }
        public Builder trackScores(boolean trackScores) { this.trackScores = trackScores; return this; }
        public Builder explain(boolean explain) { this.explain = explain; return this; }
        public Builder version(boolean version) { this.version = version; return this; }
        public Builder searchType(SearchType searchType) { this.searchType = searchType; return this; }

        /** Entries: field name, {@link SortOption} or raw DSL map. */
        public Builder sort(List<?> sort) {
            this.sort = sort == null ? null : new ArrayList<>(sort);
            return this;
        }

        public Builder addSort(Object entry) {
            if (this.sort == null) {
                this.sort = new ArrayList<>();
            }
            this.sort.add(entry);
            return this;
        }

        public Builder source(boolean enabled) { this.source = enabled; return this; }

        public Builder source(List<String> includes) {
            this.source = includes == null ? null : List.copyOf(includes);
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(this);
        }
    }
}
