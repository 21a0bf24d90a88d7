package io.polychain.provider;

import io.polychain.rpc.PolychainExecutors;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Derives a plural operation from its single-item form.
 *
 * <p>
 * One task per input runs on the executor and every task is awaited on its
 * own, so a failing item never prevents collecting the others. A failed item
 * yields {@code null} at its index and is reported to the
 * {@link FanOutListener}. The output always has exactly as many elements as
 * the input; anything else is an internal invariant breach.
 *
 * <pre>{@code
 * BatchFanOut fanOut = BatchFanOut.defaults();
 * List<AddressInfo> infos = fanOut.apply("getAddress", addresses, client::getAddress);
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> instances are immutable and thread-safe.
 * Handlers must not rely on shared mutable state.
 */
public final class BatchFanOut {

    private final ExecutorService executor;
    private final FanOutListener listener;

    public BatchFanOut(final ExecutorService executor, final FanOutListener listener) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Returns a fan-out on the shared I/O executor that logs failures.
     */
    public static BatchFanOut defaults() {
        return DefaultHolder.INSTANCE;
    }

    public BatchFanOut withListener(final FanOutListener listener) {
        return new BatchFanOut(executor, listener);
    }

    /**
     * Applies {@code handler} to every input concurrently.
     *
     * @param handlerName name reported to the listener for failed items
     * @param inputs the items, in order
     * @param handler the single-item operation
     * @return one output per input, {@code null} where the handler failed
     * @throws IllegalStateException if the output count differs from the input count
     * @throws CancellationException if the calling thread is interrupted; outstanding items are cancelled
     */
    public <T, R> List<@Nullable R> apply(
            final String handlerName,
            final List<T> inputs,
            final Function<? super T, ? extends R> handler) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        final List<Future<? extends R>> futures = new ArrayList<>(inputs.size());
        for (final T input : inputs) {
            futures.add(executor.submit(() -> handler.apply(input)));
        }

        final List<@Nullable R> outputs = new ArrayList<>(inputs.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outputs.add(futures.get(i).get());
            } catch (ExecutionException e) {
                listener.onItemFailure(handlerName, inputs.get(i), e.getCause());
                outputs.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new CancellationException("Interrupted while calling " + handlerName);
            }
        }

        if (outputs.size() != inputs.size()) {
            throw new IllegalStateException(
                    "Batch call " + inputs.size() + " requests, but received " + outputs.size() + " results");
        }
        return Collections.unmodifiableList(outputs);
    }

    private static final class DefaultHolder {
        static final BatchFanOut INSTANCE =
                new BatchFanOut(PolychainExecutors.newIoBoundExecutor(), FanOutListener.logging());
    }
}
