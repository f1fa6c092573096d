package ai.attackframework.tools.opensearch.utils.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.attackframework.tools.opensearch.errors.ConfigurationException;
import ai.attackframework.tools.opensearch.utils.Logger;

/**
 * Immutable connection settings for an OpenSearch cluster.
 *
 * <p>Built through {@link #builder()}. Normalization runs in {@link Builder#build()}: hosts get a
 * scheme, AWS region and service are detected from {@code *.amazonaws.com} endpoints.</p>
 */
public final class OpenSearchConfig {

    private final List<String> hosts;
    private final String username;
    private final String password;
    private final boolean useSsl;
    private final boolean verifyCerts;
    private final int timeoutSeconds;
    private final int maxRetries;
    private final boolean retryOnTimeout;
    private final int connectionPoolSize;
    private final String awsRegion;
    private final String awsAccessKeyId;
    private final String awsSecretAccessKey;
    private final String awsSessionToken;
    private final String awsService;
    private final Map<String, String> headers;
    private final int asyncPoolSize;

    private OpenSearchConfig(Builder b, List<String> hosts, String awsRegion, String awsService) {
        this.hosts = List.copyOf(hosts);
        this.username = b.username;
        this.password = b.password;
        this.useSsl = b.useSsl;
        this.verifyCerts = b.verifyCerts;
        this.timeoutSeconds = b.timeoutSeconds;
        this.maxRetries = b.maxRetries;
        this.retryOnTimeout = b.retryOnTimeout;
        this.connectionPoolSize = b.connectionPoolSize;
        this.awsRegion = awsRegion;
        this.awsAccessKeyId = b.awsAccessKeyId;
        this.awsSecretAccessKey = b.awsSecretAccessKey;
        this.awsSessionToken = b.awsSessionToken;
        this.awsService = awsService;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.asyncPoolSize = b.asyncPoolSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this config's values (secrets included). */
    public Builder toBuilder() {
        Builder b = new Builder()
                .hosts(hosts)
                .useSsl(useSsl)
                .verifyCerts(verifyCerts)
                .timeoutSeconds(timeoutSeconds)
                .maxRetries(maxRetries)
                .retryOnTimeout(retryOnTimeout)
                .connectionPoolSize(connectionPoolSize)
                .awsRegion(awsRegion)
                .awsAccessKeyId(awsAccessKeyId)
                .awsSecretAccessKey(awsSecretAccessKey)
                .awsSessionToken(awsSessionToken)
                .awsService(awsService)
                .headers(headers)
                .asyncPoolSize(asyncPoolSize);
        b.username = username;
        b.password = password;
        return b;
    }

    public List<String> hosts() { return hosts; }
    public String username() { return username; }
    public String password() { return password; }
    public boolean useSsl() { return useSsl; }
    public boolean verifyCerts() { return verifyCerts; }
    public int timeoutSeconds() { return timeoutSeconds; }
    public int maxRetries() { return maxRetries; }
    public boolean retryOnTimeout() { return retryOnTimeout; }
    public int connectionPoolSize() { return connectionPoolSize; }
    public String awsRegion() { return awsRegion; }
    public String awsAccessKeyId() { return awsAccessKeyId; }
    public String awsSecretAccessKey() { return awsSecretAccessKey; }
    public String awsSessionToken() { return awsSessionToken; }
    public String awsService() { return awsService; }
    public Map<String, String> headers() { return headers; }
    public int asyncPoolSize() { return asyncPoolSize; }

    /** True when requests are SigV4-signed. */
    public boolean isAws() {
        return awsRegion != null && !awsRegion.isBlank();
    }

    public boolean hasBasicAuth() {
        return username != null && password != null;
    }

    /**
     * Cache key for connector reuse. Two configs that would produce identical transports share a key.
     */
    public String cacheKey() {
        return String.join(",", hosts)
                + "|u=" + (username == null ? "" : username)
                + "|p=" + (password == null ? 0 : password.hashCode())
                + "|ssl=" + useSsl + "|verify=" + verifyCerts
                + "|t=" + timeoutSeconds + "|pool=" + connectionPoolSize
                + "|aws=" + (awsRegion == null ? "" : awsRegion + "/" + awsService)
                + "|ak=" + (awsAccessKeyId == null ? "" : awsAccessKeyId)
                + "|h=" + headers;
    }

    @Override
    public String toString() {
        return "OpenSearchConfig{hosts=" + hosts
                + ", auth=" + (hasBasicAuth() ? "basic" : isAws() ? "sigv4" : "none")
                + ", useSsl=" + useSsl
                + ", verifyCerts=" + verifyCerts
                + ", timeoutSeconds=" + timeoutSeconds
                + ", maxRetries=" + maxRetries
                + ", awsRegion=" + awsRegion
                + ", awsService=" + awsService + '}';
    }

    /** Mutable builder; {@link #build()} validates and normalizes. */
    public static final class Builder {
        private List<String> hosts = new ArrayList<>();
        private String username;
        private String password;
        private boolean useSsl = true;
        private boolean verifyCerts = true;
        private int timeoutSeconds = OpenSearchDefaults.TIMEOUT_SECONDS;
        private int maxRetries = OpenSearchDefaults.MAX_RETRIES;
        private boolean retryOnTimeout = true;
        private int connectionPoolSize = OpenSearchDefaults.POOL_SIZE;
        private String awsRegion;
        private String awsAccessKeyId;
        private String awsSecretAccessKey;
        private String awsSessionToken;
        private String awsService = OpenSearchDefaults.AWS_SERVICE_ES;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private int asyncPoolSize = OpenSearchDefaults.ASYNC_POOL_SIZE;

        private Builder() {}

        public Builder hosts(List<String> hosts) {
            this.hosts = hosts == null ? new ArrayList<>() : new ArrayList<>(hosts);
            return this;
        }

        public Builder host(String host) {
            this.hosts.add(host);
            return this;
        }

        public Builder basicAuth(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder useSsl(boolean useSsl) { this.useSsl = useSsl; return this; }
        public Builder verifyCerts(boolean verifyCerts) { this.verifyCerts = verifyCerts; return this; }
        public Builder timeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryOnTimeout(boolean retryOnTimeout) { this.retryOnTimeout = retryOnTimeout; return this; }
        public Builder connectionPoolSize(int size) { this.connectionPoolSize = size; return this; }
        public Builder awsRegion(String awsRegion) { this.awsRegion = awsRegion; return this; }
        public Builder awsAccessKeyId(String id) { this.awsAccessKeyId = id; return this; }
        public Builder awsSecretAccessKey(String key) { this.awsSecretAccessKey = key; return this; }
        public Builder awsSessionToken(String token) { this.awsSessionToken = token; return this; }
        public Builder awsService(String awsService) { this.awsService = awsService; return this; }
        public Builder asyncPoolSize(int asyncPoolSize) { this.asyncPoolSize = asyncPoolSize; return this; }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        /**
         * Validates and normalizes.
         *
         * @throws ConfigurationException when no host is given or a numeric setting is out of range
         */
        public OpenSearchConfig build() {
            List<String> normalized = new ArrayList<>();
            for (String h : hosts) {
                if (h != null && !h.isBlank()) {
                    normalized.add(normalizeHost(h.trim(), useSsl));
                }
            }
            if (normalized.isEmpty()) {
                throw new ConfigurationException("At least one host is required");
            }
            if (timeoutSeconds <= 0) {
                throw new ConfigurationException("timeoutSeconds must be positive: " + timeoutSeconds);
            }
            if (maxRetries < 0) {
                throw new ConfigurationException("maxRetries must not be negative: " + maxRetries);
            }
            if (connectionPoolSize <= 0 || asyncPoolSize <= 0) {
                throw new ConfigurationException("pool sizes must be positive");
            }

            String region = blankToNull(awsRegion);
            boolean anyAws = normalized.stream().anyMatch(h -> h.contains(".amazonaws.com"));
            if (region == null && anyAws) {
                region = detectRegion(normalized.get(0));
                Logger.logInfo("[OpenSearch] Auto-detected AWS region: " + region);
            }
            String service = awsService == null ? OpenSearchDefaults.AWS_SERVICE_ES : awsService;
            if (region != null) {
                service = normalized.stream().anyMatch(h -> h.contains("aoss."))
                        ? OpenSearchDefaults.AWS_SERVICE_SERVERLESS
                        : OpenSearchDefaults.AWS_SERVICE_ES;
            }
            return new OpenSearchConfig(this, normalized, region, service);
        }

        static String normalizeHost(String host, boolean useSsl) {
            String h = host;
            if (!h.startsWith("http://") && !h.startsWith("https://")) {
                h = (useSsl ? "https://" : "http://") + h;
            }
            while (h.endsWith("/")) {
                h = h.substring(0, h.length() - 1);
            }
            return h;
        }

        /** e.g. search-x.us-west-2.es.amazonaws.com: region is 4th token from the end. */
        static String detectRegion(String host) {
            String bare = host.replaceFirst("^https?://", "");
            int slash = bare.indexOf('/');
            if (slash >= 0) {
                bare = bare.substring(0, slash);
            }
            int colon = bare.indexOf(':');
            if (colon >= 0) {
                bare = bare.substring(0, colon);
            }
            String[] parts = bare.split("\\.");
            if (parts.length >= 4) {
                return parts[parts.length - 4];
            }
            return OpenSearchDefaults.AWS_DEFAULT_REGION;
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
