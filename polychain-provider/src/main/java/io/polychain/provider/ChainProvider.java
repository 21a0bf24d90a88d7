package io.polychain.provider;

import io.polychain.core.crypto.Signer;
import io.polychain.core.crypto.Verifier;
import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressValidation;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.SignedTx;
import io.polychain.core.model.UnsignedTx;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Transaction and address logic of one chain.
 *
 * <p>
 * Providers are stateless apart from their {@link ChainInfo} and the
 * {@link ClientSelector} they use to reach a node. Operations that need no
 * node (address validation, most signing) never trigger client resolution.
 *
 * <p>
 * Optional capabilities ({@link #signMessage}, {@link #verifyMessage}) throw
 * {@link NotImplementedException} unless a chain overrides them;
 * {@link #verifyTokenAddress} falls back to {@link #verifyAddress}.
 */
public abstract class ChainProvider {

    private final ChainInfo chainInfo;
    private final ClientSelector clientSelector;

    protected ChainProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
        this.chainInfo = Objects.requireNonNull(chainInfo, "chainInfo");
        this.clientSelector = Objects.requireNonNull(clientSelector, "clientSelector");
    }

    public ChainInfo chainInfo() {
        return chainInfo;
    }

    protected ChainClient client() {
        return client(ClientFilter.any());
    }

    protected ChainClient client(final ClientFilter filter) {
        return clientSelector.select(filter);
    }

    protected <T extends ChainClient> T client(final Class<T> type) {
        return type.cast(client(ClientFilter.ofType(type)));
    }

    /**
     * Derives the address controlled by a public key.
     *
     * @param verifier holder of the public key
     * @param encoding chain-specific address flavour, or {@code null} for the default
     */
    public abstract String pubkeyToAddress(Verifier verifier, @Nullable String encoding);

    public abstract AddressValidation verifyAddress(String address);

    /**
     * Completes a transaction with values looked up from a node (nonce, fee
     * price, fee limit, chain payload). Values already set are kept.
     *
     * @return a new, completed transaction
     */
    public abstract UnsignedTx buildUnsignedTx(UnsignedTx unsignedTx);

    /**
     * Signs a completed transaction.
     *
     * @param signers signers keyed by input address
     */
    public abstract SignedTx signTransaction(UnsignedTx unsignedTx, Map<String, Signer> signers);

    public AddressValidation verifyTokenAddress(final String address) {
        return verifyAddress(address);
    }

    public String signMessage(final String message, final Signer signer, final @Nullable String address) {
        throw new NotImplementedException("signMessage");
    }

    public boolean verifyMessage(final String address, final String message, final String signature) {
        throw new NotImplementedException("verifyMessage");
    }
}
