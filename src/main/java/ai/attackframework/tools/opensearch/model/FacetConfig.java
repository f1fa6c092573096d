package ai.attackframework.tools.opensearch.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terms facet definition.
 *
 * @param field       keyword field to bucket on
 * @param name        aggregation name, {@code <field>_terms} when {@code null}
 * @param size        number of buckets
 * @param minDocCount minimum bucket size
 * @param order       optional bucket order, e.g. {@code {"_count": "desc"}}
 */
public record FacetConfig(String field, String name, int size, int minDocCount, Map<String, String> order) {

    public FacetConfig {
        Objects.requireNonNull(field, "field");
        name = name == null || name.isBlank() ? field + "_terms" : name;
        order = order == null ? null : Map.copyOf(order);
    }

    public FacetConfig(String field) {
        this(field, null, 10, 1, null);
    }

    public Map<String, Object> toDsl() {
        Map<String, Object> terms = new LinkedHashMap<>();
        terms.put("field", field);
        terms.put("size", size);
        terms.put("min_doc_count", minDocCount);
        if (order != null) {
            terms.put("order", new LinkedHashMap<>(order));
        }
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put(name, Map.of("terms", terms));
        return dsl;
    }
}
