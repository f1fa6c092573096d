package ai.attackframework.tools.opensearch.errors;

/** Rejected credentials or missing permissions (HTTP 401/403). */
public class AuthenticationException extends OpenSearchOperationException {
    public AuthenticationException(String message, Throwable originalError) {
        super("Authentication error: " + message, originalError);
    }
}
