package io.polychain.provider;

import java.util.Objects;

/**
 * Predicate narrowing which clients of a chain may serve a request.
 *
 * <p>
 * Providers use it when an operation needs a specific client kind, e.g. a
 * method only one node flavour exposes:
 *
 * <pre>{@code
 * StcClient stc = (StcClient) selector.select(ClientFilter.ofType(StcClient.class));
 * }</pre>
 */
@FunctionalInterface
public interface ClientFilter {

    boolean test(ChainClient client);

    default ClientFilter and(final ClientFilter other) {
        Objects.requireNonNull(other, "other");
        return client -> test(client) && other.test(client);
    }

    static ClientFilter any() {
        return client -> true;
    }

    static ClientFilter ofType(final Class<? extends ChainClient> type) {
        Objects.requireNonNull(type, "type");
        return type::isInstance;
    }
}
