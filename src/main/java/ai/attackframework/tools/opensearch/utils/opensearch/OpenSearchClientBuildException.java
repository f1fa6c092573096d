package ai.attackframework.tools.opensearch.utils.opensearch;

import java.util.List;

import ai.attackframework.tools.opensearch.errors.ConfigurationException;

/** The transport for a configuration could not be constructed (bad URL, SSL setup, missing AWS SDK). */
public final class OpenSearchClientBuildException extends ConfigurationException {

    private final List<String> hosts;

    public OpenSearchClientBuildException(String message, List<String> hosts, Throwable cause) {
        super(message, cause);
        this.hosts = List.copyOf(hosts);
    }

    /** Hosts of the configuration that failed to build. */
    public List<String> hosts() {
        return hosts;
    }
}
