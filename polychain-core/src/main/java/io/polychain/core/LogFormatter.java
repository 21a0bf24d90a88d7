package io.polychain.core;

import static io.polychain.core.AnsiColors.AMBER;
import static io.polychain.core.AnsiColors.CORAL;
import static io.polychain.core.AnsiColors.INDIGO;
import static io.polychain.core.AnsiColors.RESET;
import static io.polychain.core.AnsiColors.SLATE;
import static io.polychain.core.AnsiColors.TEAL;

/**
 * Log formatter producing colored, bracketed single-line records.
 *
 * <pre>{@code
 * DebugLogger.logRpc(() -> LogFormatter.formatRpc("chain.info", 1060));
 * // [RPC] method=chain.info duration=1.06ms
 *
 * DebugLogger.logProvider(() -> LogFormatter.formatClientSelected("STC", "StcClient", 4200));
 * // ✓ [CLIENT] chain=STC client=StcClient duration=4.20ms
 * }</pre>
 *
 * <p>
 * All methods are thread-safe and free of side effects.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=chain.info duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: [RPC-BATCH] calls=3 first=state.get_resource duration=2.10ms
     */
    public static String formatBatch(int calls, String firstMethod, long durationMicros) {
        return String.format(
                "%s[RPC-BATCH]%s calls=%d first=%s %s",
                INDIGO, RESET,
                calls,
                firstMethod,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=chain.info code=404 message=Wrong response&lt;404&gt; duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [REST] GET path=/cosmos/... status=200 duration=3.02ms
     */
    public static String formatRest(String httpMethod, String path, int status, long durationMicros) {
        return String.format(
                "%s[REST]%s %s path=%s status=%d %s",
                INDIGO, RESET,
                httpMethod,
                path,
                status,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [CLIENT] chain=STC client=StcClient duration=4.20ms
     */
    public static String formatClientSelected(String chainCode, String client, long durationMicros) {
        return String.format(
                "%s✓%s %s[CLIENT]%s chain=%s client=%s %s",
                TEAL, RESET,
                AMBER, RESET,
                chainCode,
                client,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [CLIENT] chain=STC candidates=2 reason=timeout
     */
    public static String formatNoClient(String chainCode, int candidates, String reason) {
        return String.format(
                "%s✗%s %s[CLIENT]%s chain=%s candidates=%d reason=%s",
                CORAL, RESET,
                AMBER, RESET,
                chainCode,
                candidates,
                CORAL + reason + RESET);
    }

    /**
     * Format: [CLIENT-CACHE] chain=STC client=StcClient expiresInMs=299000
     */
    public static String formatCacheHit(String chainCode, String client, long expiresInMillis) {
        return String.format(
                "%s[CLIENT-CACHE]%s chain=%s client=%s expiresInMs=%d",
                SLATE, RESET,
                chainCode,
                client,
                expiresInMillis);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }
}
