package io.polychain.chains.stc;

import io.polychain.core.model.ChainInfo;
import io.polychain.provider.ChainImplementation;
import io.polychain.provider.ChainProvider;
import io.polychain.provider.ClientFactory;
import io.polychain.provider.ClientSelector;
import java.util.List;
import java.util.Map;

/**
 * Starcoin module, registered as {@code "stc"} with the {@code StcClient} client.
 */
public final class StcImplementation implements ChainImplementation {

    public static final String ID = "stc";
    public static final String CLIENT = "StcClient";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, ClientFactory> clientFactories() {
        return Map.of(CLIENT, StcImplementation::createClient);
    }

    @Override
    public ChainProvider createProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
        return new StcProvider(chainInfo, clientSelector);
    }

    private static StcClient createClient(final List<Object> args) {
        if (args.isEmpty() || !(args.get(0) instanceof String)) {
            throw new IllegalArgumentException(CLIENT + " expects a node URL as first argument, got: " + args);
        }
        return new StcClient((String) args.get(0));
    }
}
