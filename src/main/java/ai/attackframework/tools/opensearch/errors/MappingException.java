package ai.attackframework.tools.opensearch.errors;

public class MappingException extends OpenSearchOperationException {

    private final String field;

    public MappingException(String message, String field, Throwable originalError) {
        super("Mapping error: " + (field != null ? "Mapping error for field '" + field + "': " + message : message),
                originalError);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
