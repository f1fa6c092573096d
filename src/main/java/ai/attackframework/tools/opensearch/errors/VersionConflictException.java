package ai.attackframework.tools.opensearch.errors;

/** Optimistic concurrency check failed on write. */
public class VersionConflictException extends OpenSearchOperationException {

    private final String indexName;
    private final String documentId;

    public VersionConflictException(String indexName, String documentId, Throwable originalError) {
        super("Version conflict for document '" + documentId + "' in index '" + indexName + "'", originalError);
        this.indexName = indexName;
        this.documentId = documentId;
    }

    VersionConflictException(String detail, Throwable originalError) {
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
