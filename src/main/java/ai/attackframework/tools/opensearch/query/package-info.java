/**
 * Query DSL builders for product search, facets, filters and similarity queries.
 */
package ai.attackframework.tools.opensearch.query;
