package ai.attackframework.tools.opensearch.errors;

import java.util.List;
import java.util.Map;

/** Bulk request failed as a whole, or the caller asked for failures to be raised. */
public class BulkOperationException extends OpenSearchOperationException {

    private final List<Map<String, Object>> errors;

    public BulkOperationException(String message, List<Map<String, Object>> errors, Throwable originalError) {
        super("Bulk operation error: " + describe(message, errors), originalError);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<Map<String, Object>> errors() {
        return errors;
    }

    private static String describe(String message, List<Map<String, Object>> errors) {
        if (errors != null && !errors.isEmpty()) {
            return "Bulk operation failed with " + errors.size() + " errors: " + message;
        }
        return message;
    }
}
