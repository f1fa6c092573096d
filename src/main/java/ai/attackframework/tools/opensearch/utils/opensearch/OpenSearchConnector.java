package ai.attackframework.tools.opensearch.utils.opensearch;

import java.io.IOException;
import java.net.URI;
import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import javax.net.ssl.SSLContext;

import ai.attackframework.tools.opensearch.utils.Logger;
import ai.attackframework.tools.opensearch.utils.Version;
import ai.attackframework.tools.opensearch.utils.config.OpenSearchConfig;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.ClientTlsStrategyBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.transport.OpenSearchTransport;
import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;

/**
 * Factory/cache for OpenSearch clients.
 *
 * <p>Ownership:
 * Clients are cached per {@link OpenSearchConfig#cacheKey()} and reused. Callers do not close the
 * returned client; {@link #release(OpenSearchConfig)} closes its transport and evicts it.</p>
 */
public final class OpenSearchConnector {

    private static final ConcurrentHashMap<String, Connection> clientCache = new ConcurrentHashMap<>();

    private OpenSearchConnector() {
        throw new AssertionError("No instances");
    }

    /**
     * Returns a cached client for the given config, creating it on first use.
     *
     * @param config connection settings
     * @return shared client
     * @throws OpenSearchClientBuildException when the client cannot be constructed
     */
    public static OpenSearchClient getClient(OpenSearchConfig config) {
        return clientCache.computeIfAbsent(config.cacheKey(), k -> buildConnection(config)).client();
    }

    /** Closes and evicts the cached client for {@code config}; no-op when absent. */
    public static void release(OpenSearchConfig config) {
        Connection c = clientCache.remove(config.cacheKey());
        if (c != null) {
            c.close();
        }
    }

    /** Number of live cached clients. */
    public static int cachedCount() {
        return clientCache.size();
    }

    private static Connection buildConnection(OpenSearchConfig config) {
        try {
            if (config.isAws()) {
                AwsTransportFactory.AwsTransport aws = AwsTransportFactory.build(config);
                Logger.logInfo("[OpenSearch] Client created for " + config.hosts()
                        + " (AWS region: " + config.awsRegion() + ", service: " + config.awsService() + ")");
                return new Connection(new OpenSearchClient(aws.transport()), List.of(aws.transport(), aws.httpClient()));
            }
            OpenSearchTransport transport = buildHttpTransport(config);
            Logger.logInfo("[OpenSearch] Client created for " + config.hosts());
            return new Connection(new OpenSearchClient(transport), List.of(transport));
        } catch (NoClassDefFoundError e) {
            throw new OpenSearchClientBuildException(
                    "AWS SDK not on classpath; add software.amazon.awssdk:auth, regions and apache-client",
                    config.hosts(), e);
        } catch (Exception e) {
            throw new OpenSearchClientBuildException("Failed to build OpenSearch client for " + config.hosts(),
                    config.hosts(), e);
        }
    }

    static OpenSearchTransport buildHttpTransport(OpenSearchConfig config)
            throws NoSuchAlgorithmException, KeyStoreException, KeyManagementException {
        HttpHost[] hosts = config.hosts().stream().map(OpenSearchConnector::toHttpHost).toArray(HttpHost[]::new);
        SSLContext trustAll = config.verifyCerts() ? null : SSLContextBuilder.create()
                .loadTrustMaterial(null, (chain, authType) -> true)
                .build();

        return ApacheHttpClient5TransportBuilder
                .builder(hosts)
                .setMapper(new JacksonJsonpMapper())
                .setDefaultHeaders(defaultHeaders(config))
                .setRequestConfigCallback(rc -> rc
                        .setResponseTimeout(Timeout.ofSeconds(config.timeoutSeconds()))
                        .setConnectionRequestTimeout(Timeout.ofSeconds(config.timeoutSeconds())))
                .setHttpClientConfigCallback(httpClientBuilder -> {
                    PoolingAsyncClientConnectionManagerBuilder cm = PoolingAsyncClientConnectionManagerBuilder.create()
                            .setMaxConnPerRoute(config.connectionPoolSize())
                            .setMaxConnTotal(config.connectionPoolSize() * hosts.length);
                    if (trustAll != null) {
                        cm.setTlsStrategy(ClientTlsStrategyBuilder.create()
                                .setSslContext(trustAll)
                                .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                                .build());
                    }
                    if (config.hasBasicAuth()) {
                        BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                        for (HttpHost host : hosts) {
                            credentialsProvider.setCredentials(new AuthScope(host),
                                    new UsernamePasswordCredentials(config.username(), config.password().toCharArray()));
                        }
                        httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
                    }
                    return httpClientBuilder.setConnectionManager(cm.build());
                })
                .build();
    }

    static HttpHost toHttpHost(String url) {
        URI uri = URI.create(url);
        int port = uri.getPort();
        if (port < 0) {
            port = "https".equals(uri.getScheme()) ? 443 : 9200;
        }
        return new HttpHost(uri.getScheme(), uri.getHost(), port);
    }

    static Header[] defaultHeaders(OpenSearchConfig config) {
        List<Header> headers = new ArrayList<>();
        config.headers().forEach((k, v) -> headers.add(new BasicHeader(k, v)));
        headers.add(new BasicHeader("User-Agent", Version.userAgent()));
        return headers.toArray(new Header[0]);
    }

    private record Connection(OpenSearchClient client, List<AutoCloseable> resources) {
        void close() {
            for (AutoCloseable r : resources) {
                try {
                    r.close();
                } catch (IOException e) {
                    Logger.logWarn("[OpenSearch] Error closing transport: " + e.getMessage());
                } catch (Exception e) {
                    Logger.logWarn("[OpenSearch] Error closing resource: " + e);
                }
            }
        }
    }
}
