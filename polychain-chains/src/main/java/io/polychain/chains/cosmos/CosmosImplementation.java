package io.polychain.chains.cosmos;

import io.polychain.core.model.ChainInfo;
import io.polychain.provider.ChainImplementation;
import io.polychain.provider.ChainProvider;
import io.polychain.provider.ClientFactory;
import io.polychain.provider.ClientSelector;
import java.util.List;
import java.util.Map;

/**
 * Cosmos SDK module, registered as {@code "cosmos"} with the {@code Tendermint} client.
 */
public final class CosmosImplementation implements ChainImplementation {

    public static final String ID = "cosmos";
    public static final String CLIENT = "Tendermint";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, ClientFactory> clientFactories() {
        return Map.of(CLIENT, CosmosImplementation::createClient);
    }

    @Override
    public ChainProvider createProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
        return new CosmosProvider(chainInfo, clientSelector);
    }

    private static Tendermint createClient(final List<Object> args) {
        if (args.isEmpty() || !(args.get(0) instanceof String)) {
            throw new IllegalArgumentException(CLIENT + " expects a gateway URL as first argument, got: " + args);
        }
        return new Tendermint((String) args.get(0));
    }
}
