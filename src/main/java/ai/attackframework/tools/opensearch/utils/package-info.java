/**
 * Shared utilities: logging facade, version lookup, retry, DSL/JSON conversion and document helpers.
 *
 * <p>No state beyond the logger's listener list; safe to call from any thread.</p>
 */
package ai.attackframework.tools.opensearch.utils;
