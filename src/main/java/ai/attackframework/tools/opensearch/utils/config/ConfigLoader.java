package ai.attackframework.tools.opensearch.utils.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import ai.attackframework.tools.opensearch.errors.ConfigurationException;
import ai.attackframework.tools.opensearch.utils.Logger;

/**
 * Builds {@link OpenSearchConfig} from environment variables or explicit parameters.
 *
 * <p>Recognized variables: {@code OPENSEARCH_HOSTS} (or {@code AWS_OPENSEARCH_ENDPOINT}),
 * {@code OPENSEARCH_USERNAME}/{@code OPENSEARCH_PASSWORD}, {@code OPENSEARCH_USE_SSL},
 * {@code OPENSEARCH_VERIFY_CERTS}, {@code OPENSEARCH_TIMEOUT}, {@code OPENSEARCH_MAX_RETRIES},
 * {@code OPENSEARCH_RETRY_ON_TIMEOUT}, the {@code AWS_*} credential variables and any number of
 * {@code OPENSEARCH_HEADER_<NAME>} entries.</p>
 */
public final class ConfigLoader {

    static final String HEADER_PREFIX = "OPENSEARCH_HEADER_";

    private ConfigLoader() {}

    public static OpenSearchConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads configuration from the given variable map.
     *
     * @param env variable map (usually {@link System#getenv()})
     * @return validated config
     * @throws ConfigurationException on malformed numeric values
     */
    public static OpenSearchConfig fromEnvironment(Map<String, String> env) {
        String hostsStr = env.get("OPENSEARCH_HOSTS");
        if (isBlank(hostsStr)) {
            hostsStr = env.get("AWS_OPENSEARCH_ENDPOINT");
        }
        if (isBlank(hostsStr)) {
            Logger.logWarn("[OpenSearch] No OpenSearch hosts configured, using " + OpenSearchDefaults.DEFAULT_HOST);
            hostsStr = OpenSearchDefaults.DEFAULT_HOST;
        }
        List<String> hosts = new ArrayList<>();
        for (String h : hostsStr.split(",")) {
            if (!h.isBlank()) {
                hosts.add(h.trim());
            }
        }

        OpenSearchConfig.Builder b = OpenSearchConfig.builder()
                .hosts(hosts)
                .useSsl(bool(env, "OPENSEARCH_USE_SSL"))
                .verifyCerts(bool(env, "OPENSEARCH_VERIFY_CERTS"))
                .retryOnTimeout(bool(env, "OPENSEARCH_RETRY_ON_TIMEOUT"))
                .timeoutSeconds(integer(env, "OPENSEARCH_TIMEOUT", OpenSearchDefaults.TIMEOUT_SECONDS))
                .maxRetries(integer(env, "OPENSEARCH_MAX_RETRIES", OpenSearchDefaults.MAX_RETRIES))
                .awsRegion(env.get("AWS_REGION"))
                .awsAccessKeyId(env.get("AWS_ACCESS_KEY_ID"))
                .awsSecretAccessKey(env.get("AWS_SECRET_ACCESS_KEY"))
                .awsSessionToken(env.get("AWS_SESSION_TOKEN"))
                .headers(headersFrom(env));

        String user = env.get("OPENSEARCH_USERNAME");
        String pass = env.get("OPENSEARCH_PASSWORD");
        if (!isBlank(user) && !isBlank(pass)) {
            b.basicAuth(user, pass);
        }
        return b.build();
    }

    /** Direct construction without touching the environment. */
    public static OpenSearchConfig fromParams(List<String> hosts, String username, String password,
                                              boolean useSsl, String awsRegion) {
        OpenSearchConfig.Builder b = OpenSearchConfig.builder()
                .hosts(hosts)
                .useSsl(useSsl)
                .awsRegion(awsRegion);
        if (username != null && password != null) {
            b.basicAuth(username, password);
        }
        return b.build();
    }

    /**
     * Uses {@code hosts} when given, the environment otherwise.
     */
    public static OpenSearchConfig get(List<String> hosts) {
        if (hosts != null && !hosts.isEmpty()) {
            return fromParams(hosts, null, null, true, null);
        }
        return fromEnvironment();
    }

    /** {@code OPENSEARCH_HEADER_X_API_KEY} becomes {@code X-Api-Key}. */
    static Map<String, String> headersFrom(Map<String, String> env) {
        Map<String, String> headers = new TreeMap<>();
        for (Map.Entry<String, String> e : env.entrySet()) {
            String key = e.getKey();
            if (key.startsWith(HEADER_PREFIX) && key.length() > HEADER_PREFIX.length()) {
                headers.put(headerName(key.substring(HEADER_PREFIX.length())), e.getValue());
            }
        }
        return headers;
    }

    static String headerName(String raw) {
        StringBuilder sb = new StringBuilder();
        for (String segment : Arrays.asList(raw.split("_"))) {
            if (segment.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('-');
            }
            sb.append(segment.substring(0, 1).toUpperCase(Locale.ROOT))
              .append(segment.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static boolean bool(Map<String, String> env, String key) {
        String v = env.get(key);
        return v == null || !v.trim().equalsIgnoreCase("false");
    }

    private static int integer(Map<String, String> env, String key, int fallback) {
        String v = env.get(key);
        if (isBlank(v)) {
            return fallback;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
