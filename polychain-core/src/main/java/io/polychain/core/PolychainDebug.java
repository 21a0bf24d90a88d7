package io.polychain.core;

/**
 * Global toggle for enabling verbose debug logging across Polychain modules.
 *
 * <p>
 * RPC logging covers single and batch JSON-RPC exchanges and REST calls.
 * Provider logging covers client resolution: readiness races, cache hits and
 * candidate rejections.
 */
public final class PolychainDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean providerLogging = false;

    private PolychainDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || providerLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        providerLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setProviderLogging(final boolean enabled) {
        providerLogging = enabled;
    }

    public static boolean isProviderLoggingEnabled() {
        return providerLogging;
    }
}
