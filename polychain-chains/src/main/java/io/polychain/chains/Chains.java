package io.polychain.chains;

import io.polychain.chains.cosmos.CosmosImplementation;
import io.polychain.chains.stc.StcImplementation;
import io.polychain.provider.ChainRegistry;

/**
 * Entry point to the bundled chain modules.
 */
public final class Chains {

    private Chains() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a registry holding every bundled module: {@code "stc"} and {@code "cosmos"}.
     */
    public static ChainRegistry defaultRegistry() {
        return ChainRegistry.builder()
                .register(new StcImplementation())
                .register(new CosmosImplementation())
                .build();
    }
}
