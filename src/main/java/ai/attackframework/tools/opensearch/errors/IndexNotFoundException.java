package ai.attackframework.tools.opensearch.errors;

public class IndexNotFoundException extends OpenSearchOperationException {

    private final String indexName;

    public IndexNotFoundException(String indexName, Throwable originalError) {
        super("Index '" + indexName + "' not found", originalError);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
