package io.polychain.chains.stc;

import io.polychain.core.crypto.Signer;
import io.polychain.core.crypto.Verifier;
import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.AddressValidation;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.SignedTx;
import io.polychain.core.model.TxInput;
import io.polychain.core.model.TxOutput;
import io.polychain.core.model.UnsignedTx;
import io.polychain.provider.ChainProvider;
import io.polychain.provider.ClientSelector;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Starcoin address handling and transaction completion.
 */
public class StcProvider extends ChainProvider {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{32}$");

    public StcProvider(final ChainInfo chainInfo, final ClientSelector clientSelector) {
        super(chainInfo, clientSelector);
    }

    @Override
    public String pubkeyToAddress(final Verifier verifier, final @Nullable String encoding) {
        throw new NotImplementedException("pubkeyToAddress");
    }

    @Override
    public AddressValidation verifyAddress(final String address) {
        if (address == null || !ADDRESS.matcher(address).matches()) {
            return AddressValidation.invalid();
        }
        final String normalized = address.toLowerCase(Locale.ROOT);
        return AddressValidation.valid(normalized, normalized);
    }

    @Override
    public UnsignedTx buildUnsignedTx(final UnsignedTx unsignedTx) {
        final StcClient client = client(StcClient.class);
        UnsignedTx tx = unsignedTx;

        if (tx.feePricePerUnit() == null) {
            tx = tx.withFeePricePerUnit(client.getFeePricePerUnit().normal().price());
        }

        final TxInput input = tx.firstInput();
        if (input != null && tx.nonce() == null) {
            final List<@Nullable AddressInfo> infos = client.getAddresses(List.of(input.address()));
            final AddressInfo info = infos.get(0);
            if (info != null && info.nonce() != null) {
                tx = tx.withNonce(info.nonce());
            }
        }

        final TxOutput output = tx.firstOutput();
        if (input != null && output != null && tx.feeLimit() == null) {
            tx = tx.withFeeLimit(new BigDecimal(client.estimateGasLimit(dryRunParams(tx, input, output))));
        }
        return tx;
    }

    @Override
    public SignedTx signTransaction(final UnsignedTx unsignedTx, final Map<String, Signer> signers) {
        throw new NotImplementedException("signTransaction");
    }

    static Map<String, Object> dryRunParams(final UnsignedTx tx, final TxInput input, final TxOutput output) {
        final String token = output.tokenAddress() == null ? StcClient.MAIN_TOKEN : output.tokenAddress();
        final Map<String, Object> script = new LinkedHashMap<>();
        script.put("code", "0x1::TransferScripts::peer_to_peer_v2");
        script.put("type_args", List.of(token));
        script.put("args", List.of(output.address(), output.value() + "u128"));

        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("sender", input.address());
        params.put("script", script);
        if (tx.nonce() != null) {
            params.put("sequence_number", tx.nonce());
        }
        if (tx.feePricePerUnit() != null) {
            params.put("gas_unit_price", tx.feePricePerUnit().toBigInteger());
        }
        return params;
    }
}
