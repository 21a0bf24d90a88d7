package io.polychain.provider;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BatchFanOutTest {

    private ExecutorService executor;
    private final List<String> failures = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        ((Logger) LoggerFactory.getLogger(BatchFanOut.class)).detachAndStopAllAppenders();
    }

    @Test
    void failedItemsBecomeNullAtTheirIndex() {
        BatchFanOut fanOut = new BatchFanOut(executor,
                (handler, input, cause) -> failures.add(handler + ":" + input + ":" + cause.getMessage()));

        List<Integer> out = fanOut.apply("getLength", List.of("a", "boom", "ccc", "boom"), s -> {
            if (s.equals("boom")) {
                throw new IllegalArgumentException("bad input");
            }
            return s.length();
        });

        assertEquals(Arrays.asList(1, null, 3, null), out);
        assertEquals(List.of("getLength:boom:bad input", "getLength:boom:bad input"), failures);
    }

    @Test
    void preservesOrderRegardlessOfCompletionOrder() {
        BatchFanOut fanOut = new BatchFanOut(executor, (handler, input, cause) -> fail("unexpected failure"));

        List<Long> out = fanOut.apply("sleep", List.of(300L, 10L, 150L), millis -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return millis;
        });

        assertEquals(List.of(300L, 10L, 150L), out);
    }

    @Test
    void emptyInput() {
        assertTrue(BatchFanOut.defaults().apply("noop", List.<String>of(), s -> s).isEmpty());
    }

    @Test
    void interruptedCallerCancels() {
        BatchFanOut fanOut = new BatchFanOut(executor, FanOutListener.logging());
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> fanOut.apply("slow", List.of(1, 2), i -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return i;
            }));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void loggingListenerReportsAtDebug() {
        Logger logger = (Logger) LoggerFactory.getLogger(BatchFanOut.class);
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            BatchFanOut.defaults().withListener(FanOutListener.logging())
                    .apply("getAddress", List.of("0xdead"), s -> {
                        throw new IllegalStateException("node down");
                    });
        } finally {
            logger.setLevel(previous);
        }

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.DEBUG, event.getLevel());
        assertTrue(event.getFormattedMessage().startsWith("Error in calling getAddress. input: 0xdead"));
        assertNotNull(event.getThrowableProxy());
    }
}
