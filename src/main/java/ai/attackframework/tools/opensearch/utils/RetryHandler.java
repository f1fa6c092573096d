package ai.attackframework.tools.opensearch.utils;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

import ai.attackframework.tools.opensearch.errors.OpenSearchErrors;

/**
 * Retry with exponential backoff for transient cluster failures.
 */
public final class RetryHandler {

    /** Markers of transient failures, matched against the server error type or the message. */
    static final List<String> RETRYABLE_MARKERS = List.of(
            "connect", "timeout", "temporarily_unavailable", "cluster_block",
            "circuit_breaking", "429", "503");

    private static final long MAX_DELAY_MS = 60_000;

    private RetryHandler() {}

    /** True when {@code error} looks transient. */
    public static boolean shouldRetry(Throwable error) {
        if (error == null) {
            return false;
        }
        String type = OpenSearchErrors.errorType(error);
        if (type != null && matches(type.toLowerCase(Locale.ROOT))) {
            return true;
        }
        int status = OpenSearchErrors.status(error);
        if (status == 429 || status == 503) {
            return true;
        }
        Throwable c = error;
        while (c != null) {
            String text = (c.getClass().getSimpleName() + " " + (c.getMessage() == null ? "" : c.getMessage()))
                    .toLowerCase(Locale.ROOT);
            if (matches(text)) {
                return true;
            }
            c = c.getCause();
        }
        return false;
    }

    private static boolean matches(String text) {
        for (String marker : RETRYABLE_MARKERS) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /** Same as {@link #retryWithBackoff(Callable, int, long, Predicate)} with {@link #shouldRetry}. */
    public static <T> T retryWithBackoff(Callable<T> call, int maxAttempts, long baseDelayMs) throws Exception {
        return retryWithBackoff(call, maxAttempts, baseDelayMs, RetryHandler::shouldRetry);
    }

    /**
     * Runs {@code call} up to {@code maxAttempts} times. Non-retryable failures are rethrown
     * immediately; the last failure is rethrown once attempts are exhausted.
     *
     * @param call        operation
     * @param maxAttempts total attempts (at least 1)
     * @param baseDelayMs delay before the second attempt; doubles each time
     * @param retryable   decides whether a failure is worth another attempt
     */
    public static <T> T retryWithBackoff(Callable<T> call, int maxAttempts, long baseDelayMs,
                                         Predicate<Throwable> retryable) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 0; ; attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                if (!retryable.test(e) || attempt >= attempts - 1) {
                    throw e;
                }
                long delay = OpenSearchUtils.calculateBackoffDelay(attempt, baseDelayMs, MAX_DELAY_MS);
                Logger.logWarn("[OpenSearch] Attempt " + (attempt + 1) + " failed, retrying in "
                        + delay + "ms: " + e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
