package ai.attackframework.tools.opensearch.utils;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Logging facade for the library.
 *
 * <p>Messages go to SLF4J under {@value #LIBRARY_LOGGER} and are mirrored to registered
 * {@link LogListener}s, so a host application can surface client activity without touching the
 * Logback configuration. DEBUG and TRACE messages reach listeners only while that level is enabled.</p>
 *
 * <p>{@link ListenerAppender} closes the loop for third-party loggers (OpenSearch client,
 * HttpClient, AWS SDK) when it is wired into {@code logback.xml}.</p>
 */
public final class Logger {

    /** Receives every mirrored message; {@code level} is the SLF4J level name. */
    public interface LogListener { void onLog(String level, String message); }

    static final String LIBRARY_LOGGER = "ai.attackframework.tools.opensearch";

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LIBRARY_LOGGER);

    private static final CopyOnWriteArrayList<LogListener> LISTENERS = new CopyOnWriteArrayList<>();

    private Logger() {}

    /** Adds {@code listener}; {@code null} and repeat registrations are ignored. */
    public static void registerListener(LogListener listener) {
        if (listener != null) {
            LISTENERS.addIfAbsent(listener);
        }
    }

    public static void unregisterListener(LogListener listener) {
        LISTENERS.remove(listener);
    }

    public static void logInfo(String msg) {
        String m = safe(msg);
        LOG.info(m);
        publish("INFO", m);
    }

    public static void logWarn(String msg) {
        String m = safe(msg);
        LOG.warn(m);
        publish("WARN", m);
    }

    public static void logDebug(String msg) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        String m = safe(msg);
        LOG.debug(m);
        publish("DEBUG", m);
    }

    public static void logTrace(String msg) {
        if (!LOG.isTraceEnabled()) {
            return;
        }
        String m = safe(msg);
        LOG.trace(m);
        publish("TRACE", m);
    }

    public static void logError(String msg) {
        String m = safe(msg);
        LOG.error(m);
        publish("ERROR", m);
    }

    /**
     * Logs with the full stack trace; listeners get {@code msg :: SimpleName: message}.
     *
     * @param t cause, may be {@code null}
     */
    public static void logError(String msg, Throwable t) {
        String m = safe(msg);
        LOG.error(m, t);
        publish("ERROR", t == null ? m : m + " :: " + t.getClass().getSimpleName() + ": " + safe(t.getMessage()));
    }

    private static void publish(String level, String message) {
        for (LogListener listener : LISTENERS) {
            try {
                listener.onLog(level, message);
            } catch (RuntimeException ex) {
                LOG.debug("Log listener {} failed: {}", listener, ex.toString());
            }
        }
    }

    private static String safe(String s) {
        return Objects.toString(s, "");
    }

    /**
     * Logback appender that mirrors events from loggers outside this library to the listener bus.
     * Library events are skipped because the facade already published them.
     */
    public static final class ListenerAppender extends AppenderBase<ILoggingEvent> {

        @Override
        protected void append(ILoggingEvent event) {
            String name = event.getLoggerName();
            if (name != null && name.startsWith(LIBRARY_LOGGER)) {
                return;
            }
            StringBuilder message = new StringBuilder(safe(event.getFormattedMessage()));
            IThrowableProxy tp = event.getThrowableProxy();
            if (tp != null) {
                message.append(" :: ").append(Objects.toString(tp.getClassName(), "Exception"));
                if (tp.getMessage() != null) {
                    message.append(": ").append(tp.getMessage());
                }
            }
            publish(event.getLevel() == null ? "INFO" : event.getLevel().toString(), message.toString());
        }
    }
}
