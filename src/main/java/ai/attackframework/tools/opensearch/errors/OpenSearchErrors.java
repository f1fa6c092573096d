package ai.attackframework.tools.opensearch.errors;

import java.util.Locale;

import org.opensearch.client.opensearch._types.ErrorCause;
import org.opensearch.client.opensearch._types.OpenSearchException;

/**
 * Maps low-level failures onto the {@link OpenSearchOperationException} hierarchy.
 *
 * <p>For typed server errors the error {@code type} and HTTP status drive the decision; for
 * everything else the lowercase message and exception class name are inspected. Checks run
 * in a fixed order and the first match wins.</p>
 */
public final class OpenSearchErrors {

    private OpenSearchErrors() {
        throw new AssertionError("No instances");
    }

    /**
     * Wraps {@code error} into the most specific library exception.
     *
     * @param error   failure to classify (library exceptions are returned unchanged)
     * @param context short description of the operation, used as message prefix
     * @return classified exception, never {@code null}
     */
    public static OpenSearchOperationException wrap(Throwable error, String context) {
        if (error instanceof OpenSearchOperationException ose) {
            return ose;
        }
        String detail = context + ": " + describe(error);
        String probe = probe(error);
        int status = status(error);

        if (probe.contains("index_not_found")) {
            return new IndexNotFoundException(extractIndex(error, detail), error);
        }
        if (probe.contains("document_missing") || probe.contains("not_found")) {
            return new DocumentNotFoundException(detail, error);
        }
        if (probe.contains("version_conflict")) {
            return new VersionConflictException(detail, error);
        }
        if (probe.contains("authentication") || probe.contains("unauthorized")
                || probe.contains("security_exception") || status == 401 || status == 403) {
            return new AuthenticationException(detail, error);
        }
        if (probe.contains("timeout") || probe.contains("timed out")) {
            return new OperationTimeoutException(detail, error);
        }
        if (probe.contains("connection") || probe.contains("connect")) {
            return new ConnectionFailedException(detail, error);
        }
        if (probe.contains("bulk")) {
            return new BulkOperationException(detail, null, error);
        }
        if (probe.contains("query") || probe.contains("search")) {
            return new SearchQueryException(detail, null, error);
        }
        if (probe.contains("resource_already_exists")) {
            return new ResourceExistsException(detail, error);
        }
        if (probe.contains("mapping")) {
            return new MappingException(detail, null, error);
        }
        return new OpenSearchOperationException(detail, error);
    }

    /** Server error type of a typed OpenSearch failure, or {@code null}. */
    public static String errorType(Throwable error) {
        Throwable c = error;
        while (c != null) {
            if (c instanceof OpenSearchException ose && ose.error() != null) {
                return ose.error().type();
            }
            c = c.getCause();
        }
        return null;
    }

    /** HTTP status of a typed OpenSearch failure, or {@code -1}. */
    public static int status(Throwable error) {
        Throwable c = error;
        while (c != null) {
            if (c instanceof OpenSearchException ose) {
                return ose.status();
            }
            c = c.getCause();
        }
        return -1;
    }

    /** True when the failure denotes a missing index or document. */
    public static boolean isNotFound(Throwable error) {
        if (error instanceof IndexNotFoundException || error instanceof DocumentNotFoundException) {
            return true;
        }
        String type = errorType(error);
        if (type != null) {
            return type.contains("not_found");
        }
        return status(error) == 404 || probe(error).contains("not_found");
    }

    private static String probe(Throwable error) {
        String type = errorType(error);
        if (type != null) {
            return type.toLowerCase(Locale.ROOT);
        }
        StringBuilder sb = new StringBuilder();
        Throwable c = error;
        while (c != null) {
            sb.append(c.getClass().getSimpleName()).append(' ');
            if (c.getMessage() != null) {
                sb.append(c.getMessage()).append(' ');
            }
            c = c.getCause();
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        if (error instanceof OpenSearchException ose && ose.error() != null) {
            ErrorCause cause = ose.error();
            String reason = cause.reason();
            return "[" + cause.type() + "] " + (reason == null ? "" : reason);
        }
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : msg;
    }

    private static String extractIndex(Throwable error, String fallback) {
        Throwable c = error;
        while (c != null) {
            if (c instanceof OpenSearchException ose && ose.error() != null) {
                ErrorCause cause = ose.error();
                if (cause.metadata() != null && cause.metadata().containsKey("index")) {
                    return cause.metadata().get("index").to(String.class);
                }
            }
            c = c.getCause();
        }
        return fallback;
    }
}
