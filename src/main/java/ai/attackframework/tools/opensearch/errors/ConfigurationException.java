package ai.attackframework.tools.opensearch.errors;

/** Invalid or incomplete client configuration. */
public class ConfigurationException extends OpenSearchOperationException {
    public ConfigurationException(String message) {
        super("Configuration error: " + message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("Configuration error: " + message, cause);
    }
}
