package io.polychain.chains.cosmos;

import io.polychain.core.crypto.Signer;
import io.polychain.core.crypto.Verifier;
import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.AddressValidation;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.SignedTx;
import io.polychain.core.model.TxInput;
import io.polychain.core.model.UnsignedTx;
import io.polychain.provider.ChainProvider;
import io.polychain.provider.ClientSelector;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Cosmos address handling and transaction completion.
 *
 * <p>
 * Addresses are bech32 strings whose human-readable part equals the
 * {@code addressPrefix} option of the chain.
 */
public class CosmosProvider extends ChainProvider {

    static final String ACCOUNT_NUMBER = "accountNumber";

    public CosmosProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
        super(chainInfo, clientSelector);
    }

    @Override
    public String pubkeyToAddress(final Verifier verifier, final @Nullable String encoding) {
        throw new NotImplementedException("pubkeyToAddress");
    }

    @Override
    public AddressValidation verifyAddress(final String address) {
        final String prefix = chainInfo().stringOption("addressPrefix");
        final Bech32.Decoded decoded = address == null ? null : Bech32.decode(address);
        if (decoded == null || prefix == null || !decoded.hrp().equals(prefix)) {
            return AddressValidation.invalid();
        }
        final String normalized = Bech32.encode(decoded.hrp(), decoded.data());
        return AddressValidation.valid(normalized, normalized);
    }

    @Override
    public UnsignedTx buildUnsignedTx(final UnsignedTx unsignedTx) {
        final Tendermint client = client(Tendermint.class);
        UnsignedTx tx = unsignedTx;

        if (tx.feePricePerUnit() == null) {
            tx = tx.withFeePricePerUnit(client.getFeePricePerUnit().normal().price());
        }

        final TxInput input = tx.firstInput();
        if (input != null && (tx.nonce() == null || !tx.payload().containsKey(ACCOUNT_NUMBER))) {
            final AddressInfo info = client.getAddress(input.address());
            if (tx.nonce() == null) {
                tx = tx.withNonce(info.nonce());
            }
            if (!tx.payload().containsKey(ACCOUNT_NUMBER) && info.accountNumber() != null) {
                tx = tx.withPayloadEntry(ACCOUNT_NUMBER, info.accountNumber());
            }
        }
        return tx;
    }

    @Override
    public SignedTx signTransaction(final UnsignedTx unsignedTx, final Map<String, Signer> signers) {
        throw new NotImplementedException("signTransaction");
    }
}
