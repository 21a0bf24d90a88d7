package io.polychain.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.polychain.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        PolychainDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void disabledCategoryNeverBuildsTheRecord() {
        AtomicBoolean built = new AtomicBoolean();

        DebugLogger.logRpc(() -> {
            built.set(true);
            return "should not appear";
        });
        DebugLogger.log(DebugLogger.Category.PROVIDER, () -> "should not appear");

        assertFalse(built.get());
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedRecordsWhenEnabled() {
        PolychainDebug.setEnabled(true);
        DebugLogger.logRpc(() -> "payload {\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("***[REDACTED]***"));
    }

    @Test
    void categoriesAreToggledSeparately() {
        PolychainDebug.setProviderLogging(true);

        DebugLogger.logRpc(() -> "rpc line");
        DebugLogger.logProvider(() -> "provider line");

        assertEquals(1, appender.list.size());
        assertEquals("provider line", appender.list.get(0).getFormattedMessage());
        assertTrue(PolychainDebug.isEnabled());
    }

    @Test
    void eachCategoryHasItsOwnLogger() {
        PolychainDebug.setEnabled(true);

        DebugLogger.logRpc(() -> LogFormatter.formatRpc("chain.info", 1060));
        DebugLogger.logProvider(() -> "provider line");

        assertEquals("io.polychain.debug.rpc", appender.list.get(0).getLoggerName());
        assertEquals("io.polychain.debug.provider", appender.list.get(1).getLoggerName());
    }
}
