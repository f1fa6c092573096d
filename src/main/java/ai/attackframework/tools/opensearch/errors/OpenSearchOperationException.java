package ai.attackframework.tools.opensearch.errors;

/**
 * Base type for every failure surfaced by this library.
 *
 * <p>Unchecked. The low-level failure (transport error, server error response) is kept as the
 * cause and appended to {@link #getMessage()}.</p>
 */
public class OpenSearchOperationException extends RuntimeException {

    private final String baseMessage;

    public OpenSearchOperationException(String message) {
        this(message, null);
    }

    public OpenSearchOperationException(String message, Throwable originalError) {
        super(message, originalError);
        this.baseMessage = message == null ? "" : message;
    }

    /** Message without the original-error suffix. */
    public String baseMessage() {
        return baseMessage;
    }

    /** Returns the wrapped low-level error, or {@code null}. */
    public Throwable originalError() {
        return getCause();
    }

    @Override
    public String getMessage() {
        Throwable original = getCause();
        if (original != null) {
            return baseMessage + " (Original: " + original + ")";
        }
        return baseMessage;
    }
}
