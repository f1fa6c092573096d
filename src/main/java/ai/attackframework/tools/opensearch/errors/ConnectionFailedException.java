package ai.attackframework.tools.opensearch.errors;

/** Cluster unreachable, connection refused or reset. */
public class ConnectionFailedException extends OpenSearchOperationException {
    public ConnectionFailedException(String message, Throwable originalError) {
        super("Connection error: " + message, originalError);
    }
}
