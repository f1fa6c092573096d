/**
 * Exception hierarchy for OpenSearch operations.
 *
 * <p>All types are unchecked. {@link ai.attackframework.tools.opensearch.errors.OpenSearchErrors}
 * classifies transport and server failures into the most specific subtype.</p>
 */
package ai.attackframework.tools.opensearch.errors;
