package ai.attackframework.tools.opensearch.utils.opensearch;

import java.net.URI;

/**
 * Formatting for DEBUG logging of raw OpenSearch exchanges (connection test, index creation,
 * slow searches). One log entry per request and per response, indented.
 */
public final class OpenSearchLogFormat {

    private static final int MAX_BODY_CHARS = 4_000;

    private OpenSearchLogFormat() {}

    /** Request line, Host header and, when a body is given, Content-Type and the body. */
    public static String buildRawRequest(String baseUrl, String method, String path, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(path).append(" HTTP/1.1");
        String host = hostHeader(baseUrl);
        if (!host.isEmpty()) {
            sb.append("\nHost: ").append(host);
        }
        appendBody(sb, body);
        return sb.toString();
    }

    /** Status line, Content-Type and body. */
    public static String buildRawResponse(int status, String body) {
        StringBuilder sb = new StringBuilder("HTTP/1.1 ").append(status).append(status == 200 ? " OK" : "");
        appendBody(sb, body);
        return sb.toString();
    }

    /** Prefixes each line with two spaces. */
    public static String indentRaw(String raw) {
        if (raw == null || raw.isEmpty()) return raw;
        return "  " + raw.replace("\n", "\n  ");
    }

    static String hostHeader(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return "";
        }
        URI uri;
        try {
            uri = URI.create(baseUrl.trim());
        } catch (IllegalArgumentException e) {
            return "";
        }
        String host = uri.getHost() != null ? uri.getHost() : "";
        int defaultPort = "https".equals(uri.getScheme()) ? 443 : 80;
        if (uri.getPort() > 0 && uri.getPort() != defaultPort) {
            host = host + ":" + uri.getPort();
        }
        return host;
    }

    private static void appendBody(StringBuilder sb, String body) {
        if (body == null || body.isEmpty()) {
            return;
        }
        String b = body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) + "...(truncated)" : body;
        sb.append("\nContent-Type: application/json\n\n").append(b);
    }
}
