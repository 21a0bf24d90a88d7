package io.polychain.core;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@link LogFormatter} records for the debug categories switched on in
 * {@link PolychainDebug}.
 *
 * <p>
 * Records are built lazily, so a disabled category costs one volatile read.
 * On a TTY the sanitized record is printed as is, colors included; otherwise it
 * goes to the {@code io.polychain.debug.<category>} logger at INFO.
 */
public final class DebugLogger {

    /** Debug category of a record. */
    public enum Category {
        RPC("rpc"),
        PROVIDER("provider");

        private final String loggerSuffix;

        Category(final String loggerSuffix) {
            this.loggerSuffix = loggerSuffix;
        }

        boolean isEnabled() {
            return this == RPC ? PolychainDebug.isRpcLoggingEnabled() : PolychainDebug.isProviderLoggingEnabled();
        }
    }

    private static final Map<Category, Logger> LOGGERS = new EnumMap<>(Category.class);

    static {
        for (final Category category : Category.values()) {
            LOGGERS.put(category, LoggerFactory.getLogger("io.polychain.debug." + category.loggerSuffix));
        }
    }

    private static final boolean TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    private DebugLogger() {
    }

    public static void logRpc(final Supplier<String> record) {
        log(Category.RPC, record);
    }

    public static void logProvider(final Supplier<String> record) {
        log(Category.PROVIDER, record);
    }

    public static void log(final Category category, final Supplier<String> record) {
        if (!category.isEnabled()) {
            return;
        }
        final String line = LogSanitizer.sanitize(record.get());
        if (TTY) {
            System.out.println(line);
        } else {
            LOGGERS.get(category).info(line);
        }
    }
}
