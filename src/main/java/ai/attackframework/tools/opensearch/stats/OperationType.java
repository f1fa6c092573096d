package ai.attackframework.tools.opensearch.stats;

import java.util.Locale;

/** Operation categories tracked per index. */
public enum OperationType {
    SEARCH, INDEX, UPDATE, DELETE, BULK;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
