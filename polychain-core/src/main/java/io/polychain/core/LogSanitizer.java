package io.polychain.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private keys and signed raw transactions</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY = Pattern.compile("\"privateKey\"\\s*:\\s*\"[^\"]+\"");

    private static final Pattern RAW_TX = Pattern.compile("\"(rawTx|tx_bytes)\"\\s*:\\s*\"[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY.matcher(sanitized).replaceAll("\"privateKey\":\"***[REDACTED]***\"");
        }

        if (sanitized.contains("\"rawTx\"") || sanitized.contains("\"tx_bytes\"")) {
            sanitized = RAW_TX.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
