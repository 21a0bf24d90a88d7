package io.polychain.provider;

import io.polychain.core.model.ChainInfo;
import java.util.Map;
import java.util.Objects;

/**
 * A chain module: the client flavours it offers and how to build its
 * provider. Registered in a {@link ChainRegistry} under {@link #id()}, which
 * {@link ChainInfo#impl()} refers to.
 */
public interface ChainImplementation {

    String id();

    /**
     * Client factories keyed by the name used in
     * {@link io.polychain.core.model.ClientConfig#name()}.
     */
    Map<String, ClientFactory> clientFactories();

    ChainProvider createProvider(ChainInfo chainInfo, ClientSelector clientSelector);

    /**
     * Builds a provider bound to a chain and a lazy client selector.
     */
    @FunctionalInterface
    interface ProviderFactory {
        ChainProvider create(ChainInfo chainInfo, ClientSelector clientSelector);
    }

    static ChainImplementation of(
            final String id,
            final Map<String, ClientFactory> clientFactories,
            final ProviderFactory providerFactory) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(providerFactory, "providerFactory");
        final Map<String, ClientFactory> factories = Map.copyOf(clientFactories);
        return new ChainImplementation() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Map<String, ClientFactory> clientFactories() {
                return factories;
            }

            @Override
            public ChainProvider createProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
                return providerFactory.create(chainInfo, clientSelector);
            }

            @Override
            public String toString() {
                return "ChainImplementation{" + id + ", clients=" + factories.keySet() + "}";
            }
        };
    }
}
