package io.polychain.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of one candidate node client for a chain.
 *
 * <p>
 * Only consulted when the provider controller builds the candidate pool for
 * a chain: {@code name} selects the client factory registered by the chain
 * implementation and {@code args} are handed to it verbatim.
 *
 * @param name the client type identifier, e.g. {@code "StcClient"}
 * @param args constructor arguments, typically the node URL first
 */
public record ClientConfig(String name, List<Object> args) {

    public ClientConfig {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static ClientConfig of(final String name, final Object... args) {
        return new ClientConfig(name, List.of(args));
    }
}
