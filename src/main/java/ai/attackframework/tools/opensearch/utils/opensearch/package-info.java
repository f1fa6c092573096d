/**
 * Client construction and connection utilities.
 *
 * <p>Builds and caches OpenSearch clients (HTTP with basic auth/TLS, or AWS SigV4) and formats raw
 * exchanges for DEBUG logging.</p>
 */
package ai.attackframework.tools.opensearch.utils.opensearch;
