package ai.attackframework.tools.opensearch;

import java.util.List;

import ai.attackframework.tools.opensearch.utils.config.ConfigLoader;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchConfig;

/**
 * Entry points for creating clients.
 */
public final class OpenSearchClients {

    private OpenSearchClients() {
        throw new AssertionError("No instances");
    }

    public static SearchClient create(OpenSearchConfig config) {
        return new OpenSearchDb(config);
    }

    public static AsyncSearchClient createAsync(OpenSearchConfig config) {
        return new AsyncOpenSearchDb(new OpenSearchDb(config), config.asyncPoolSize());
    }

    /**
     * Client for {@code hosts}, or for the environment configuration when {@code hosts} is empty.
     *
     * @return an {@link AsyncSearchClient} when {@code async}, otherwise a {@link SearchClient}
     */
    public static AutoCloseable create(List<String> hosts, boolean async) {
        OpenSearchConfig config = ConfigLoader.get(hosts);
        return async ? createAsync(config) : create(config);
    }
}
