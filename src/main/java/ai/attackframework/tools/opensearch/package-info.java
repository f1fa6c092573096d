/**
 * Client entry points: {@link ai.attackframework.tools.opensearch.OpenSearchClients}, the blocking
 * {@link ai.attackframework.tools.opensearch.SearchClient} and its async counterpart.
 */
package ai.attackframework.tools.opensearch;
