package io.polychain.provider;

import io.polychain.core.model.ChainInfo;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the {@link ChainInfo} of a chain code. This is the configuration
 * boundary between the embedding application and the controller.
 */
@FunctionalInterface
public interface ChainSelector {

    /**
     * @throws IllegalArgumentException if the chain code is unknown
     */
    ChainInfo select(String chainCode);

    /**
     * Returns a selector over a fixed set of chains, keyed by {@link ChainInfo#code()}.
     */
    static ChainSelector of(final Collection<ChainInfo> chains) {
        final Map<String, ChainInfo> byCode = new LinkedHashMap<>();
        for (final ChainInfo chain : chains) {
            byCode.put(chain.code(), chain);
        }
        return chainCode -> {
            final ChainInfo chain = byCode.get(chainCode);
            if (chain == null) {
                throw new IllegalArgumentException("Unknown chain code: " + chainCode);
            }
            return chain;
        };
    }
}
