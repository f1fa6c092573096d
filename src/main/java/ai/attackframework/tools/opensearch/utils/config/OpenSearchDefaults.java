package ai.attackframework.tools.opensearch.utils.config;

/**
 * Library-wide defaults and limits.
 */
public final class OpenSearchDefaults {

    private OpenSearchDefaults() {}

    // Connection
    public static final int TIMEOUT_SECONDS = 30;
    public static final int MAX_RETRIES = 3;
    public static final int POOL_SIZE = 10;
    public static final int ASYNC_POOL_SIZE = 4;
    public static final String DEFAULT_HOST = "localhost:9200";
    public static final long RETRY_BASE_DELAY_MS = 500;

    // Paging
    public static final int PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
    public static final int SEARCH_SIZE = 10;
    public static final int MAX_SEARCH_SIZE = 1000;
    public static final int MAX_RESULT_WINDOW = 10_000;
    public static final String SCROLL_KEEP_ALIVE = "2m";
    public static final int SCROLL_BATCH_SIZE = 100;
    public static final int AUTOCOMPLETE_SIZE = 5;
    public static final int MORE_LIKE_THIS_RESULTS = 10;

    // Bulk
    public static final int BULK_BATCH_SIZE = 1000;
    public static final int MAX_BULK_BATCH_SIZE = 5000;
    public static final int BULK_RETRY_ATTEMPTS = 3;
    public static final long BULK_RETRY_DELAY_MS = 1_000;
    public static final long MAX_BULK_BATCH_BYTES = 5L * 1024 * 1024;
    public static final int RETRY_QUEUE_CAPACITY = 10_000;
    public static final int RETRY_DRAIN_BATCH_SIZE = 100;

    // Index settings
    public static final int SHARDS = 1;
    public static final int REPLICAS = 1;
    public static final String REFRESH_INTERVAL = "1s";

    // Query tuning
    public static final String FUZZINESS = "AUTO";
    public static final String MINIMUM_SHOULD_MATCH = "75%";
    public static final int MAX_SUGGESTIONS = 10;

    // Monitoring
    public static final long STATS_RETENTION_HOURS = 24;
    public static final long SLOW_QUERY_THRESHOLD_MS = 1_000;

    // AWS
    public static final String AWS_SERVICE_ES = "es";
    public static final String AWS_SERVICE_SERVERLESS = "aoss";
    public static final String AWS_DEFAULT_REGION = "us-east-1";

    public static final String PRODUCTS_INDEX = "products";
}
