package ai.attackframework.tools.opensearch.errors;

/** Request did not complete within the configured timeout. */
public class OperationTimeoutException extends OpenSearchOperationException {

    public OperationTimeoutException(String message, Throwable originalError) {
        super("Timeout error: " + message, originalError);
    }

    public OperationTimeoutException(String message, int timeoutSeconds) {
        super("Timeout error: Operation timeout after " + timeoutSeconds + " seconds: " + message);
    }
}
