package ai.attackframework.tools.opensearch.query;

import java.util.Locale;

import ai.attackframework.tools.opensearch.errors.SearchQueryException;

/** Comparison operators accepted by {@link OpenSearchQueryBuilder#buildFilterQuery}. */
public enum FilterOperator {
    EQ, NE, GT, GTE, LT, LTE, IN, RANGE, EXISTS, MISSING, PREFIX, WILDCARD, REGEXP;

    /**
     * Parses {@code eq}, {@code gte}, ... case-insensitively.
     *
     * @throws SearchQueryException for unknown operators
     */
    public static FilterOperator parse(String op) {
        if (op != null) {
            for (FilterOperator f : values()) {
                if (f.name().equals(op.trim().toUpperCase(Locale.ROOT))) {
                    return f;
                }
            }
        }
        throw new SearchQueryException("Invalid operator: " + op);
    }
}
