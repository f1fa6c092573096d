package ai.attackframework.tools.opensearch.query;

/**
 * Inclusive price bounds.
 */
public record PriceRange(Number min, Number max) {}
