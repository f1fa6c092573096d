package ai.attackframework.tools.opensearch.query;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import ai.attackframework.tools.opensearch.errors.SearchQueryException;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Query DSL builders for e-commerce search: product search with filters, facets, autocomplete,
 * range/geo filters, aggregations, scoring and similarity.
 *
 * <p>All methods return plain {@code Map} DSL ready to be placed in a request body.</p>
 */
public final class OpenSearchQueryBuilder {

    static final List<String> PRODUCT_FIELDS = List.of(
            "name^3", "description^2", "category^1.5", "brand^1.2", "tags^1", "sku");

    private OpenSearchQueryBuilder() {}

    /**
     * Product search: boosted multi-field text match plus structured filters.
     *
     * @param text       free text; no text clause when blank
     * @param filters    extra {@code field -> value} filters on {@code <field>.keyword}; list values use terms
     * @param category   exact category
     * @param priceRange inclusive price bounds
     * @param brand      a brand name or a list of names
     * @param attributes nested attribute name/value pairs
     * @param inStock    restrict to {@code stock > 0}
     * @return bool query, or {@code match_all} when there are no clauses
     */
    public static Map<String, Object> buildProductSearchQuery(String text, Map<String, Object> filters,
                                                              String category, PriceRange priceRange,
                                                              Object brand, Map<String, Object> attributes,
                                                              boolean inStock) {
        List<Object> must = new ArrayList<>();
        List<Object> filter = new ArrayList<>();

        if (text != null && !text.isEmpty()) {
            Map<String, Object> multiMatch = new LinkedHashMap<>();
            multiMatch.put("query", text);
            multiMatch.put("fields", PRODUCT_FIELDS);
            multiMatch.put("fuzziness", OpenSearchDefaults.FUZZINESS);
            multiMatch.put("minimum_should_match", OpenSearchDefaults.MINIMUM_SHOULD_MATCH);
            multiMatch.put("type", "best_fields");
            must.add(Map.of("multi_match", multiMatch));
        }
        if (category != null && !category.isEmpty()) {
            filter.add(Map.of("term", Map.of("category.keyword", category)));
        }
        if (priceRange != null) {
            Map<String, Object> bounds = new LinkedHashMap<>();
            if (priceRange.min() != null) {
                bounds.put("gte", priceRange.min());
            }
            if (priceRange.max() != null) {
                bounds.put("lte", priceRange.max());
            }
            if (!bounds.isEmpty()) {
                filter.add(Map.of("range", Map.of("price", bounds)));
            }
        }
        if (brand instanceof List<?> brands) {
            if (!brands.isEmpty()) {
                filter.add(Map.of("terms", Map.of("brand.keyword", brands)));
            }
        } else if (brand != null && !brand.toString().isEmpty()) {
            filter.add(Map.of("term", Map.of("brand.keyword", brand)));
        }
        if (inStock) {
            filter.add(Map.of("range", Map.of("stock", Map.of("gt", 0))));
        }
        if (filters != null) {
            filters.forEach((field, value) -> {
                if (value == null) {
                    return;
                }
                String key = field + ".keyword";
                filter.add(value instanceof List<?>
                        ? Map.of("terms", Map.of(key, value))
                        : Map.of("term", Map.of(key, value)));
            });
        }
        if (attributes != null) {
            attributes.forEach((name, value) -> {
                if (value == null) {
                    return;
                }
                Map<String, Object> bool = Map.of("must", List.of(
                        Map.of("term", Map.of("attributes.name.keyword", name)),
                        Map.of("term", Map.of("attributes.value.keyword", value))));
                Map<String, Object> nested = new LinkedHashMap<>();
                nested.put("path", "attributes");
                nested.put("query", Map.of("bool", bool));
                filter.add(Map.of("nested", nested));
            });
        }

        if (must.isEmpty() && filter.isEmpty()) {
            return matchAll();
        }
        Map<String, Object> bool = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            bool.put("must", must);
        }
        if (!filter.isEmpty()) {
            bool.put("filter", filter);
        }
        return Map.of("bool", bool);
    }

    /** Category, brand, price-band and rating facets. */
    public static Map<String, Object> buildProductFacets() {
        Map<String, Object> aggs = new LinkedHashMap<>();
        aggs.put("categories", termsFacet("category.keyword"));
        aggs.put("brands", termsFacet("brand.keyword"));

        List<Map<String, Object>> ranges = List.of(
                band("Under ₹1000", null, 1000),
                band("₹1000 - ₹5000", 1000, 5000),
                band("₹5000 - ₹10000", 5000, 10000),
                band("₹10000 - ₹20000", 10000, 20000),
                band("Above ₹20000", 20000, null));
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("field", "price");
        range.put("ranges", ranges);
        aggs.put("price_ranges", Map.of("range", range));

        Map<String, Object> histogram = new LinkedHashMap<>();
        histogram.put("field", "average_rating");
        histogram.put("interval", 1);
        histogram.put("extended_bounds", Map.of("min", 0, "max", 5));
        aggs.put("ratings", Map.of("histogram", histogram));
        return aggs;
    }

    private static Map<String, Object> termsFacet(String field) {
        Map<String, Object> terms = new LinkedHashMap<>();
        terms.put("field", field);
        terms.put("size", 10);
        terms.put("order", List.of(Map.of("_count", "desc")));
        return Map.of("terms", terms);
    }

    private static Map<String, Object> band(String key, Integer from, Integer to) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("key", key);
        if (from != null) {
            b.put("from", from);
        }
        if (to != null) {
            b.put("to", to);
        }
        return b;
    }

    /**
     * Completion suggester named {@code autocomplete} on {@code <field>.suggest}.
     *
     * @return {@code {"suggest": {"autocomplete": {...}}}}
     */
    public static Map<String, Object> buildAutocompleteQuery(String field, String prefix, int size) {
        Map<String, Object> fuzzy = new LinkedHashMap<>();
        fuzzy.put("fuzziness", 1);
        fuzzy.put("min_length", 3);
        fuzzy.put("prefix_length", 1);

        Map<String, Object> completion = new LinkedHashMap<>();
        completion.put("field", field + ".suggest");
        completion.put("size", size);
        completion.put("skip_duplicates", true);
        completion.put("fuzzy", fuzzy);

        Map<String, Object> autocomplete = new LinkedHashMap<>();
        autocomplete.put("prefix", prefix);
        autocomplete.put("completion", completion);
        return Map.of("suggest", Map.of("autocomplete", autocomplete));
    }

    /** String-operator form of {@link #buildFilterQuery(String, FilterOperator, Object, Object)}. */
    public static Map<String, Object> buildFilterQuery(String field, String operator, Object value, Object value2) {
        return buildFilterQuery(field, FilterOperator.parse(operator), value, value2);
    }

    public static Map<String, Object> buildFilterQuery(String field, String operator, Object value) {
        return buildFilterQuery(field, operator, value, null);
    }

    /**
     * Single-field filter.
     *
     * @param value2 upper bound for {@link FilterOperator#RANGE} when {@code value} is the lower bound
     * @throws SearchQueryException when a range is not given as two bounds, or a value-based
     *                              operator gets a {@code null} value
     */
    public static Map<String, Object> buildFilterQuery(String field, FilterOperator op, Object value, Object value2) {
        if (value == null && op != FilterOperator.EXISTS && op != FilterOperator.MISSING
                && op != FilterOperator.RANGE) {
            throw new SearchQueryException("Operator " + op.name().toLowerCase(Locale.ROOT) + " requires a value");
        }
        switch (op) {
            case EQ:
                return Map.of("term", Map.of(field, value));
            case NE:
                return mustNot(Map.of("term", Map.of(field, value)));
            case GT:
            case GTE:
            case LT:
            case LTE:
                return Map.of("range", Map.of(field, Map.of(op.name().toLowerCase(Locale.ROOT), value)));
            case IN:
                return Map.of("terms", Map.of(field, value instanceof List<?> ? value : List.of(value)));
            case RANGE:
                Object[] bounds = rangeBounds(value, value2);
                Map<String, Object> range = new LinkedHashMap<>();
                range.put("gte", bounds[0]);
                range.put("lte", bounds[1]);
                return Map.of("range", Map.of(field, range));
            case EXISTS:
                return Map.of("exists", Map.of("field", field));
            case MISSING:
                return mustNot(Map.of("exists", Map.of("field", field)));
            case PREFIX:
                return Map.of("prefix", Map.of(field, value));
            case WILDCARD:
                return Map.of("wildcard", Map.of(field, value));
            case REGEXP:
                return Map.of("regexp", Map.of(field, value));
            default:
                throw new SearchQueryException("Invalid operator: " + op);
        }
    }

    private static Object[] rangeBounds(Object value, Object value2) {
        if (value instanceof List<?> list) {
            if (list.size() != 2) {
                throw new SearchQueryException("Range operator requires tuple/list of length 2");
            }
            return new Object[] {list.get(0), list.get(1)};
        }
        if (value instanceof Object[] arr && arr.length == 2) {
            return arr;
        }
        if (value != null && value2 != null && !(value instanceof Object[])) {
            return new Object[] {value, value2};
        }
        throw new SearchQueryException("Range operator requires tuple/list of length 2");
    }

    private static Map<String, Object> mustNot(Map<String, Object> clause) {
        return Map.of("bool", Map.of("must_not", List.of(clause)));
    }

    /**
     * Inclusive date range with ISO-8601 bounds; either bound may be {@code null}.
     */
    public static Map<String, Object> buildDateRangeQuery(String field, LocalDateTime start, LocalDateTime end,
                                                          String timeZone) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("time_zone", timeZone == null ? "UTC" : timeZone);
        if (start != null) {
            range.put("gte", start.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }
        if (end != null) {
            range.put("lte", end.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }
        return Map.of("range", Map.of(field, range));
    }

    public static Map<String, Object> buildRecentDocumentsQuery(String field, int days) {
        return buildRecentDocumentsQuery(field, days, Clock.systemUTC());
    }

    /** Documents with {@code field} within the last {@code days} days (UTC). */
    public static Map<String, Object> buildRecentDocumentsQuery(String field, int days, Clock clock) {
        LocalDateTime cutoff = LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).minusDays(days);
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("gte", cutoff.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        range.put("time_zone", "UTC");
        return Map.of("range", Map.of(field == null ? "created_at" : field, range));
    }

    /** Points within {@code distance} (e.g. {@code 10km}, {@code 5mi}) of the given location. */
    public static Map<String, Object> buildGeoDistanceQuery(String field, double lat, double lon, String distance) {
        Map<String, Object> geo = new LinkedHashMap<>();
        geo.put("distance", distance == null ? "10km" : distance);
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("lat", lat);
        point.put("lon", lon);
        geo.put(field, point);
        return Map.of("geo_distance", geo);
    }

    /** Body with {@code size: 0}, the aggregations and an optional query. */
    public static Map<String, Object> buildAggregationQuery(Map<String, Object> aggs, Map<String, Object> query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("aggs", aggs);
        body.put("size", 0);
        if (query != null && !query.isEmpty()) {
            body.put("query", query);
        }
        return body;
    }

    public static Map<String, Object> buildScoringQuery(Map<String, Object> baseQuery, List<Map<String, Object>> functions) {
        Map<String, Object> fs = new LinkedHashMap<>();
        fs.put("query", baseQuery);
        fs.put("functions", functions);
        fs.put("score_mode", "multiply");
        fs.put("boost_mode", "multiply");
        return Map.of("function_score", fs);
    }

    public static Map<String, Object> buildMoreLikeThisQuery(List<String> fields, List<String> likeTexts,
                                                             List<Map<String, Object>> likeDocs) {
        return buildMoreLikeThisQuery(fields, likeTexts, likeDocs, 1, 12, 1);
    }

    /**
     * {@code more_like_this} over {@code fields}; {@code like} holds texts then document refs.
     */
    public static Map<String, Object> buildMoreLikeThisQuery(List<String> fields, List<String> likeTexts,
                                                             List<Map<String, Object>> likeDocs,
                                                             int minTermFreq, int maxQueryTerms, int minDocFreq) {
        Map<String, Object> mlt = new LinkedHashMap<>();
        mlt.put("fields", fields);
        mlt.put("min_term_freq", minTermFreq);
        mlt.put("max_query_terms", maxQueryTerms);
        mlt.put("min_doc_freq", minDocFreq);
        mlt.put("min_word_length", 3);
        List<Object> like = new ArrayList<>();
        if (likeTexts != null) {
            like.addAll(likeTexts);
        }
        if (likeDocs != null) {
            like.addAll(likeDocs);
        }
        if (!like.isEmpty()) {
            mlt.put("like", like);
        }
        return Map.of("more_like_this", mlt);
    }

    public static Map<String, Object> matchAll() {
        return Map.of("match_all", Map.of());
    }
}
