package io.polychain.chains.stc;

import com.fasterxml.jackson.databind.JsonNode;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.BalanceRequest;
import io.polychain.core.model.ClientInfo;
import io.polychain.core.model.FeePrice;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.TransactionStatus;
import io.polychain.provider.AbstractChainClient;
import io.polychain.rpc.JsonRpcClient;
import io.polychain.rpc.RpcCall;
import io.polychain.rpc.internal.RpcUtils;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Starcoin node client over JSON-RPC.
 *
 * <p>
 * Plural lookups go out as a single lenient batch, so a failing element only
 * blanks the item it belongs to.
 */
public class StcClient extends AbstractChainClient {

    static final String MAIN_TOKEN = "0x1::STC::STC";
    static final BigInteger DEFAULT_GAS_LIMIT = BigInteger.valueOf(127_845L);

    private static final Map<String, Boolean> DECODE = Map.of("decode", true);

    private final JsonRpcClient rpc;

    public StcClient(final String url) {
        this(JsonRpcClient.create(url));
    }

    public StcClient(final JsonRpcClient rpc) {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    @Override
    public ClientInfo getInfo() {
        final JsonNode info = rpc.call("chain.info", List.of());
        final BigInteger number = RpcUtils.quantity(info.path("head").path("number"));
        final long bestBlockNumber = number == null ? 0L : number.longValueExact();
        return new ClientInfo(bestBlockNumber, bestBlockNumber > 0);
    }

    @Override
    public List<@Nullable AddressInfo> getAddresses(final List<String> addresses) {
        final List<RpcCall> calls = new ArrayList<>(addresses.size() * 3);
        for (final String address : addresses) {
            calls.add(RpcCall.of("state.get_resource", address, "0x1::Account::Account", DECODE));
            calls.add(RpcCall.of("txpool.next_sequence_number", address));
            calls.add(RpcCall.of("state.get_resource", address, balanceResource(null), DECODE));
        }
        final List<@Nullable JsonNode> results = rpc.batchCall(calls, null, true);

        final List<@Nullable AddressInfo> infos = new ArrayList<>(addresses.size());
        for (int i = 0; i < results.size(); i += 3) {
            final JsonNode state = results.get(i);
            final JsonNode nextSequence = results.get(i + 1);
            final JsonNode balance = results.get(i + 2);
            if (state == null || nextSequence == null || balance == null) {
                infos.add(null);
                continue;
            }
            final BigInteger sequence = RpcUtils.quantityOr(state.path("json").path("sequence_number"), BigInteger.ZERO);
            final BigInteger next = RpcUtils.quantityOr(nextSequence, BigInteger.ZERO);
            infos.add(new AddressInfo(tokenValue(balance), !state.isNull(), sequence.max(next).longValueExact()));
        }
        return Collections.unmodifiableList(infos);
    }

    @Override
    public List<@Nullable BigInteger> getBalances(final List<BalanceRequest> requests) {
        final List<RpcCall> calls = new ArrayList<>(requests.size());
        for (final BalanceRequest request : requests) {
            calls.add(RpcCall.of(
                    "state.get_resource", request.address(), balanceResource(request.coin().tokenAddress()), DECODE));
        }
        final List<@Nullable BigInteger> balances = new ArrayList<>(requests.size());
        for (final JsonNode resource : rpc.batchCall(calls, null, true)) {
            balances.add(resource == null ? null : tokenValue(resource));
        }
        return Collections.unmodifiableList(balances);
    }

    @Override
    public List<@Nullable TransactionStatus> getTransactionStatuses(final List<String> txids) {
        final List<RpcCall> calls = new ArrayList<>(txids.size() * 2);
        for (final String txid : txids) {
            calls.add(RpcCall.of("txpool.pending_txn", txid));
            calls.add(RpcCall.of("chain.get_transaction_info", txid));
        }
        final List<@Nullable JsonNode> results = rpc.batchCall(calls, null, true);

        final List<@Nullable TransactionStatus> statuses = new ArrayList<>(txids.size());
        for (int i = 0; i < results.size(); i += 2) {
            final JsonNode pending = results.get(i);
            final JsonNode receipt = results.get(i + 1);
            if (pending == null || receipt == null) {
                statuses.add(null);
            } else if (pending.isNull() && receipt.isNull()) {
                statuses.add(TransactionStatus.NOT_FOUND);
            } else if (!pending.isNull()) {
                statuses.add(TransactionStatus.PENDING);
            } else if ("Executed".equals(receipt.path("status").asText())) {
                statuses.add(TransactionStatus.CONFIRM_AND_SUCCESS);
            } else {
                statuses.add(TransactionStatus.CONFIRM_BUT_FAILED);
            }
        }
        return Collections.unmodifiableList(statuses);
    }

    @Override
    public FeePricePerUnit getFeePricePerUnit() {
        final JsonNode price = rpc.call("txpool.gas_price", List.of());
        return FeePricePerUnit.of(FeePrice.of(RpcUtils.quantityOr(price, BigInteger.ONE).longValueExact()));
    }

    @Override
    public boolean broadcastTransaction(final String rawTx) {
        final JsonNode txid = rpc.call("txpool.submit_hex_transaction", List.of(rawTx));
        return txid.isTextual() && txid.asText().length() == 66;
    }

    /**
     * Dry-runs a transaction to learn its gas usage.
     *
     * @param params the {@code contract.dry_run} request object
     * @return the gas used, or {@link #DEFAULT_GAS_LIMIT} if the dry run did not execute
     */
    public BigInteger estimateGasLimit(final Map<String, Object> params) {
        final JsonNode result = rpc.call("contract.dry_run", List.of(params));
        if ("Executed".equals(result.path("status").asText())) {
            return RpcUtils.quantityOr(result.get("gas_used"), DEFAULT_GAS_LIMIT);
        }
        return DEFAULT_GAS_LIMIT;
    }

    static String balanceResource(final @Nullable String tokenAddress) {
        return "0x1::Account::Balance<" + (tokenAddress == null ? MAIN_TOKEN : tokenAddress) + ">";
    }

    private static BigInteger tokenValue(final JsonNode resource) {
        return RpcUtils.quantityOr(resource.path("json").path("token").path("value"), BigInteger.ZERO);
    }
}
