package io.polychain.provider;

import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.BalanceRequest;
import io.polychain.core.model.CoinInfo;
import io.polychain.core.model.PartialTokenInfo;
import io.polychain.core.model.TransactionStatus;
import io.polychain.core.model.Utxo;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Base class for chains whose nodes only answer single-item queries.
 *
 * <p>
 * Subclasses implement the singular operations ({@link #getAddress},
 * {@link #getTransactionStatus}, optionally {@link #getBalance},
 * {@link #getTokenInfo} and {@link #getUtxo}); every plural operation of
 * {@link ChainClient} is derived from them through a {@link BatchFanOut},
 * with a failed item turning into {@code null} at its index.
 */
public abstract class SimpleChainClient extends AbstractChainClient {

    private final BatchFanOut fanOut;

    protected SimpleChainClient() {
        this(BatchFanOut.defaults());
    }

    protected SimpleChainClient(final BatchFanOut fanOut) {
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    }

    protected BatchFanOut fanOut() {
        return fanOut;
    }

    public abstract AddressInfo getAddress(String address);

    /**
     * Returns the balance of one address. Defaults to the balance reported
     * by {@link #getAddress(String)}, which only covers the main coin.
     */
    public BigInteger getBalance(final String address, final CoinInfo coin) {
        return getAddress(address).balance();
    }

    public abstract TransactionStatus getTransactionStatus(String txid);

    public @Nullable PartialTokenInfo getTokenInfo(final String tokenAddress) {
        throw new NotImplementedException("getTokenInfo");
    }

    public List<Utxo> getUtxo(final String address) {
        throw new NotImplementedException("getUtxo");
    }

    @Override
    public List<@Nullable AddressInfo> getAddresses(final List<String> addresses) {
        return fanOut.apply("getAddress", addresses, this::getAddress);
    }

    @Override
    public List<@Nullable BigInteger> getBalances(final List<BalanceRequest> requests) {
        return fanOut.apply("getBalance", requests, request -> getBalance(request.address(), request.coin()));
    }

    @Override
    public List<@Nullable TransactionStatus> getTransactionStatuses(final List<String> txids) {
        return fanOut.apply("getTransactionStatus", txids, this::getTransactionStatus);
    }

    @Override
    public List<@Nullable PartialTokenInfo> getTokenInfos(final List<String> tokenAddresses) {
        return fanOut.apply("getTokenInfo", tokenAddresses, this::getTokenInfo);
    }

    /**
     * Looks up outputs address by address. An address whose lookup failed
     * maps to an empty list.
     */
    @Override
    public Map<String, List<Utxo>> getUtxos(final List<String> addresses) {
        final List<@Nullable List<Utxo>> outputs = fanOut.apply("getUtxo", addresses, this::getUtxo);
        final Map<String, List<Utxo>> byAddress = new LinkedHashMap<>();
        for (int i = 0; i < addresses.size(); i++) {
            final List<Utxo> utxos = outputs.get(i);
            byAddress.put(addresses.get(i), utxos == null ? List.of() : utxos);
        }
        return Collections.unmodifiableMap(byAddress);
    }
}
