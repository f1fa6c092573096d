/**
 * Batched bulk operations with retry and a bounded per-index retry queue.
 */
package ai.attackframework.tools.opensearch.bulk;
