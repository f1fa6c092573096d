package ai.attackframework.tools.opensearch.model;

import java.util.Locale;

public enum SortOrder {
    ASC, DESC;

    /** Wire value: {@code asc} / {@code desc}. */
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
