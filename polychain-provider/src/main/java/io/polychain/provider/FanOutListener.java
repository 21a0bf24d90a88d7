package io.polychain.provider;

/**
 * Observer for per-item failures swallowed by {@link BatchFanOut}.
 */
@FunctionalInterface
public interface FanOutListener {

    /**
     * Called once for every item whose handler failed. The item's output slot
     * is {@code null}.
     *
     * @param handlerName name of the single-item operation, e.g. {@code "getAddress"}
     * @param input the offending input
     * @param cause why the handler failed
     */
    void onItemFailure(String handlerName, Object input, Throwable cause);

    /**
     * Returns a listener that logs each failure at DEBUG.
     */
    static FanOutListener logging() {
        return LoggingFanOutListener.INSTANCE;
    }
}
