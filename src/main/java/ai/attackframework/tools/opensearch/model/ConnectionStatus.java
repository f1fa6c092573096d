package ai.attackframework.tools.opensearch.model;

/**
 * Result of a connection probe ({@code GET /}).
 *
 * @param success      whether the cluster answered
 * @param distribution e.g. {@code opensearch}; empty on failure
 * @param version      server version number; empty on failure
 * @param message      human-readable outcome
 */
public record ConnectionStatus(boolean success, String distribution, String version, String message) {}
