package ai.attackframework.tools.opensearch;

import java.util.LinkedHashMap;
import java.util.Map;

import ai.attackframework.tools.opensearch.query.PriceRange;
import ai.attackframework.tools.opensearch.query.ProductSort;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Storefront search parameters. Pages are 1-based; {@code perPage} is capped at
 * {@link OpenSearchDefaults#MAX_PAGE_SIZE}.
 */
public record ProductSearchRequest(String text, Map<String, Object> filters, String category,
                                   PriceRange priceRange, Object brand, Map<String, Object> attributes,
                                   boolean inStock, ProductSort sortBy, int page, int perPage) {

    public ProductSearchRequest {
        filters = filters == null ? Map.of() : new LinkedHashMap<>(filters);
        attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
        sortBy = sortBy == null ? ProductSort.RELEVANCE : sortBy;
        page = Math.max(1, page);
        perPage = perPage <= 0 ? OpenSearchDefaults.PAGE_SIZE : Math.min(perPage, OpenSearchDefaults.MAX_PAGE_SIZE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int from() {
        return (page - 1) * perPage;
    }

    public static final class Builder {
        private String text;
        private Map<String, Object> filters;
        private String category;
        private PriceRange priceRange;
        private Object brand;
        private Map<String, Object> attributes;
        private boolean inStock;
        private ProductSort sortBy = ProductSort.RELEVANCE;
        private int page = 1;
        private int perPage = OpenSearchDefaults.PAGE_SIZE;

        private Builder() {}

        public Builder text(String text) { this.text = text; return this; }
        public Builder filters(Map<String, Object> filters) { this.filters = filters; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder priceRange(Number min, Number max) { this.priceRange = new PriceRange(min, max); return this; }
        public Builder priceRange(PriceRange priceRange) { this.priceRange = priceRange; return this; }
        public Builder brand(Object brand) { this.brand = brand; return this; }
        public Builder attributes(Map<String, Object> attributes) { this.attributes = attributes; return this; }
        public Builder inStock(boolean inStock) { this.inStock = inStock; return this; }
        public Builder sortBy(ProductSort sortBy) { this.sortBy = sortBy; return this; }
        public Builder sortBy(String key) { this.sortBy = ProductSort.fromKey(key); return this; }
        public Builder page(int page) { this.page = page; return this; }
        public Builder perPage(int perPage) { this.perPage = perPage; return this; }

        public ProductSearchRequest build() {
            return new ProductSearchRequest(text, filters, category, priceRange, brand, attributes,
                    inStock, sortBy, page, perPage);
        }
    }
}
