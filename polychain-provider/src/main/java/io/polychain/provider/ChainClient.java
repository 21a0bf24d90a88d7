package io.polychain.provider;

import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.BalanceRequest;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.ClientInfo;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.PartialTokenInfo;
import io.polychain.core.model.TransactionStatus;
import io.polychain.core.model.Utxo;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Read and broadcast access to one node of one chain.
 *
 * <p>
 * Implementations are built by a {@link ChainImplementation} from a
 * {@link io.polychain.core.model.ClientConfig}, bound to their chain through
 * {@link #setChainInfo(ChainInfo)} before first use, and owned by the
 * {@link ProviderController} pool of that chain. An instance is never shared
 * across chains.
 *
 * <p>
 * <strong>Plural operations</strong> return a list of the same length as
 * their input. A {@code null} element means the lookup for that item failed;
 * it never shifts the positions of the others. {@link SimpleChainClient}
 * derives all plural operations from single-item ones for chains that have
 * no native batch form.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe; the
 * controller may run a readiness check and caller operations concurrently.
 *
 * @see AbstractChainClient
 * @see SimpleChainClient
 */
public interface ChainClient extends AutoCloseable {

    /**
     * Binds this client to its chain. Called once by the controller before
     * any other method.
     *
     * @throws IllegalStateException if already bound to a different chain
     */
    void setChainInfo(ChainInfo chainInfo);

    /**
     * @throws IllegalStateException if not bound yet
     */
    ChainInfo chainInfo();

    /**
     * Reports the node's best block and whether it is fit to serve requests.
     * This is the readiness probe used by the controller.
     */
    ClientInfo getInfo();

    List<@Nullable AddressInfo> getAddresses(List<String> addresses);

    List<@Nullable BigInteger> getBalances(List<BalanceRequest> requests);

    List<@Nullable TransactionStatus> getTransactionStatuses(List<String> txids);

    FeePricePerUnit getFeePricePerUnit();

    /**
     * Submits a signed transaction.
     *
     * @param rawTx the serialized signed transaction, see {@link io.polychain.core.model.SignedTx#rawTx()}
     * @return whether the node accepted it
     */
    boolean broadcastTransaction(String rawTx);

    default List<@Nullable PartialTokenInfo> getTokenInfos(final List<String> tokenAddresses) {
        throw new NotImplementedException("getTokenInfos");
    }

    /**
     * Looks up unspent outputs for UTXO chains.
     *
     * @return every requested address mapped to its outputs
     */
    default Map<String, List<Utxo>> getUtxos(final List<String> addresses) {
        throw new NotImplementedException("getUtxos");
    }

    /**
     * Releases resources held by this client. The default does nothing.
     */
    @Override
    default void close() {
        // Default no-op for clients that hold nothing
    }
}
