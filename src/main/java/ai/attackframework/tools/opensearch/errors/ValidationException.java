package ai.attackframework.tools.opensearch.errors;

/** Caller input rejected before any request is sent (index names, chunk sizes, missing ids). */
public class ValidationException extends OpenSearchOperationException {
    public ValidationException(String message) {
        super(message);
    }
}
