/**
 * In-process performance statistics for OpenSearch operations.
 */
package ai.attackframework.tools.opensearch.stats;
