package io.polychain.provider;

import io.polychain.core.error.NoAvailableClientException;
import org.jspecify.annotations.Nullable;

/**
 * Lazily resolves a ready client for the chain a provider is bound to.
 *
 * <p>
 * The controller hands each provider a selector that defers to
 * {@link ProviderController#getClient(String, ClientFilter)}, so resolution
 * (and any readiness race) only happens when the provider actually needs a
 * node.
 */
@FunctionalInterface
public interface ClientSelector {

    /**
     * @param filter restricts eligible clients; {@code null} accepts any
     * @return a ready client
     * @throws NoAvailableClientException if no eligible client becomes ready
     */
    ChainClient select(@Nullable ClientFilter filter);
}
