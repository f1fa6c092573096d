package ai.attackframework.tools.opensearch.utils;

import java.util.ArrayList;
import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggerTest {

    private final List<String> seen = new ArrayList<>();
    private final Logger.LogListener listener = (level, msg) -> seen.add(level + ":" + msg);

    @AfterEach
    void unregister() {
        Logger.unregisterListener(listener);
    }

    @Test
    void registerListener_receivesInfoAndErrorLogs() {
        Logger.registerListener(listener);

        Logger.logInfo("hello");
        Logger.logError("world");

        assertThat(seen).containsExactly("INFO:hello", "ERROR:world");
    }

    @Test
    void registerListener_isIdempotent_noDuplicateDelivery() {
        Logger.registerListener(listener);
        Logger.registerListener(listener);

        Logger.logWarn("once");

        assertThat(seen).containsExactly("WARN:once");
    }

    @Test
    void unregisterListener_stopsDelivery() {
        Logger.registerListener(listener);
        Logger.logInfo("before");
        Logger.unregisterListener(listener);
        Logger.logInfo("after");

        assertThat(seen).containsExactly("INFO:before");
    }

    @Test
    void logDebug_mirroredWhileDebugEnabled() {
        Logger.registerListener(listener);

        Logger.logDebug("batch 1/2");

        // logback-test.xml enables DEBUG for the library logger
        assertThat(seen).containsExactly("DEBUG:batch 1/2");
    }

    @Test
    void logErrorWithThrowable_appendsConciseSummary() {
        Logger.registerListener(listener);

        Logger.logError("bulk failed", new IllegalStateException("boom"));

        assertThat(seen).containsExactly("ERROR:bulk failed :: IllegalStateException: boom");
    }

    @Test
    void throwingListener_doesNotBreakOthers() {
        Logger.LogListener bad = (level, msg) -> { throw new RuntimeException("listener failure"); };
        Logger.registerListener(bad);
        Logger.registerListener(listener);
        try {
            Logger.logInfo("still delivered");
        } finally {
            Logger.unregisterListener(bad);
        }

        assertThat(seen).containsExactly("INFO:still delivered");
    }

    @Test
    void listenerAppender_forwardsThirdPartyEvents_skipsInternal() {
        Logger.registerListener(listener);
        LoggerContext ctx = new LoggerContext();
        Logger.ListenerAppender appender = new Logger.ListenerAppender();
        appender.setContext(ctx);
        appender.start();

        ch.qos.logback.classic.Logger client = ctx.getLogger("org.opensearch.client.transport");
        appender.doAppend(new LoggingEvent("x", client, Level.WARN, "node down", null, null));
        ch.qos.logback.classic.Logger internal = ctx.getLogger("ai.attackframework.tools.opensearch");
        appender.doAppend(new LoggingEvent("x", internal, Level.INFO, "already mirrored", null, null));

        assertThat(seen).containsExactly("WARN:node down");
        appender.stop();
    }
}
