package io.polychain.provider;

import java.util.List;

/**
 * Builds a client from the arguments of a
 * {@link io.polychain.core.model.ClientConfig}.
 */
@FunctionalInterface
public interface ClientFactory {

    /**
     * @param args the configured arguments, typically the node URL first
     * @throws IllegalArgumentException if the arguments do not fit the client
     */
    ChainClient create(List<Object> args);
}
