package ai.attackframework.tools.opensearch.errors;

public class DocumentNotFoundException extends OpenSearchOperationException {

    private final String indexName;
    private final String documentId;

    public DocumentNotFoundException(String indexName, String documentId, Throwable originalError) {
        super("Document '" + documentId + "' not found in index '" + indexName + "'", originalError);
        this.indexName = indexName;
        this.documentId = documentId;
    }

    /** Used by error classification, where only a free-form detail is known. */
    DocumentNotFoundException(String detail, Throwable originalError) {
        super(detail, originalError);
        this.indexName = null;
        this.documentId = null;
    }

    public String indexName() {
        return indexName;
    }

    public String documentId() {
        return documentId;
    }
}
