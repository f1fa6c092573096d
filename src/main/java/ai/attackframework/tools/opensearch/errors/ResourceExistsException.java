package ai.attackframework.tools.opensearch.errors;

public class ResourceExistsException extends OpenSearchOperationException {

    private final String resourceType;
    private final String resourceName;

    public ResourceExistsException(String resourceType, String resourceName, Throwable originalError) {
        super(resourceType + " '" + resourceName + "' already exists", originalError);
        this.resourceType = resourceType;
        this.resourceName = resourceName;
    }

    ResourceExistsException(String detail, Throwable originalError) {
        super(detail, originalError);
        this.resourceType = null;
        this.resourceName = null;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceName() {
        return resourceName;
    }
}
