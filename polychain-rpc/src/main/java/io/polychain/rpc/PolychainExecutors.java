package io.polychain.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors Polychain runs blocking node calls on.
 *
 * <p>
 * Readiness races and fan-out batches spend nearly all of their time waiting
 * on HTTP, so they run on an unbounded pool of daemon threads that grows with
 * concurrent demand and shrinks when idle.
 *
 * <pre>{@code
 * ExecutorService exec = PolychainExecutors.newIoBoundExecutor();
 * ProviderController controller = ProviderController.builder(registry, selector)
 *         .executor(exec)
 *         .build();
 * }</pre>
 */
public final class PolychainExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private PolychainExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for I/O-bound work.
     *
     * <p>
     * Threads are daemons named {@code polychain-io-N} and are reclaimed after
     * 60 seconds of idleness.
     *
     * @return a cached thread pool
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "polychain-io-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
