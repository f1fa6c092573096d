package ai.attackframework.tools.opensearch.model;

import java.util.Locale;

public enum SearchType {
    QUERY_THEN_FETCH, DFS_QUERY_THEN_FETCH;

    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
