package ai.attackframework.tools.opensearch.utils;

import java.util.List;
import java.util.Map;

import ai.attackframework.tools.opensearch.errors.SearchQueryException;
import ai.attackframework.tools.opensearch.query.OpenSearchQueryBuilder;
import org.junit.jupiter.api.Test;
import org.opensearch.client.opensearch._types.ShardStatistics;
import org.opensearch.client.opensearch._types.SortOptions;
import org.opensearch.client.opensearch._types.aggregations.Aggregation;
import org.opensearch.client.opensearch._types.query_dsl.Query;
import org.opensearch.client.opensearch.core.SearchRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DslJsonTest {

    @Test
    void query_readsBoolQuery() {
        Map<String, Object> dsl = OpenSearchQueryBuilder.buildProductSearchQuery(
                "phone", null, "electronics", null, null, null, true);

        Query query = DslJson.query(dsl);

        assertThat(query.isBool()).isTrue();
        assertThat(query.bool().must()).hasSize(1);
        assertThat(query.bool().filter()).hasSize(2);
    }

    @Test
    void shardsToMap_keepsIntegerCounts() {
        Map<String, Object> shards = DslJson.shardsToMap(ShardStatistics.of(b -> b.total(2).successful(2).failed(0)));

        assertThat(shards).containsExactly(
                Map.entry("total", 2), Map.entry("successful", 2), Map.entry("failed", 0));
        assertThat(shards.get("failed")).isInstanceOf(Integer.class);
        assertThat(DslJson.shardsToMap(null)).isEmpty();
    }

    @Test
    void query_invalidDsl_throwsSearchQueryException() {
        assertThatThrownBy(() -> DslJson.query(Map.of("no_such_query", Map.of())))
                .isInstanceOf(SearchQueryException.class)
                .hasMessageContaining("Invalid query DSL");
    }

    @Test
    void aggregations_readFacetDefinitions() {
        Map<String, Aggregation> aggs = DslJson.aggregations(OpenSearchQueryBuilder.buildProductFacets());

        assertThat(aggs).containsOnlyKeys("categories", "brands", "price_ranges", "ratings");
        assertThat(aggs.get("categories").isTerms()).isTrue();
        assertThat(aggs.get("price_ranges").isRange()).isTrue();
        assertThat(aggs.get("ratings").isHistogram()).isTrue();
    }

    @Test
    void sort_acceptsFieldNamesAndMaps() {
        List<SortOptions> sort = DslJson.sort(List.of("_score", Map.of("price", Map.of("order", "desc"))));

        assertThat(sort).hasSize(2);
        assertThat(sort.get(1).isField()).isTrue();
        assertThat(sort.get(1).field().field()).isEqualTo("price");
    }

    @Test
    void expandSort_turnsFieldNamesIntoOrderMaps() {
        assertThat(DslJson.expandSort(List.of("_score", "name")))
                .containsExactly(Map.of("_score", Map.of("order", "desc")), Map.of("name", Map.of("order", "asc")));
    }

    @Test
    void searchRequest_readsFullBody() {
        Map<String, Object> body = OpenSearchQueryBuilder.buildAggregationQuery(
                OpenSearchQueryBuilder.buildProductFacets(), OpenSearchQueryBuilder.matchAll());

        SearchRequest request = DslJson.searchRequest(body);

        assertThat(request.size()).isZero();
        assertThat(request.aggregations()).containsKey("brands");
        assertThat(request.query().isMatchAll()).isTrue();
    }

    @Test
    void toMap_serializesTypedObjects() {
        Query query = DslJson.query(Map.of("term", Map.of("category.keyword", "books")));

        Map<String, Object> map = DslJson.toMap(query);

        assertThat(map).containsKey("term");
        assertThat(DslJson.toMap(null)).isEmpty();
    }

    @Test
    void write_producesCompactJson() {
        assertThat(DslJson.write(Map.of("match_all", Map.of()))).isEqualTo("{\"match_all\":{}}");
    }
}
