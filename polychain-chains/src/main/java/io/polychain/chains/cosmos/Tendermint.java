package io.polychain.chains.cosmos;

import com.fasterxml.jackson.databind.JsonNode;
import io.polychain.core.error.ProtocolException;
import io.polychain.core.error.TransportException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.ClientInfo;
import io.polychain.core.model.CoinInfo;
import io.polychain.core.model.FeePrice;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.TransactionStatus;
import io.polychain.provider.BatchFanOut;
import io.polychain.provider.SimpleChainClient;
import io.polychain.rpc.RestfulClient;
import io.polychain.rpc.internal.RpcUtils;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Cosmos SDK node client over the REST gateway.
 *
 * <p>
 * Options read from {@link ChainInfo#implOptions()}: {@code mainCoinDenom}
 * (required for balances) and {@code gasPriceStep} (optional map of
 * {@code min}, {@code normal} and {@code high}).
 */
public class Tendermint extends SimpleChainClient {

    static final Duration MAX_BLOCK_AGE = Duration.ofSeconds(120);
    static final long DEFAULT_NORMAL_GAS_PRICE = 250L;
    static final long DEFAULT_MIN_GAS_PRICE = 100L;
    static final long DEFAULT_HIGH_GAS_PRICE = 400L;

    private static final int BROADCAST_MODE_SYNC = 2;

    private final RestfulClient rest;
    private final Clock clock;

    public Tendermint(final String url) {
        this(RestfulClient.builder(url).build(), Clock.systemUTC(), BatchFanOut.defaults());
    }

    public Tendermint(final RestfulClient rest, final Clock clock, final BatchFanOut fanOut) {
        super(fanOut);
        this.rest = Objects.requireNonNull(rest, "rest");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ready when the latest block is at most two minutes away from the local clock.
     */
    @Override
    public ClientInfo getInfo() {
        final JsonNode header = rest.get("/cosmos/base/tendermint/v1beta1/blocks/latest").path("block").path("header");
        final long height = RpcUtils.quantityOr(header.get("height"), BigInteger.ZERO).longValueExact();
        final Instant blockTime = blockTime(header.path("time").asText(null));
        final boolean fresh = blockTime != null
                && Duration.between(blockTime, clock.instant()).abs().compareTo(MAX_BLOCK_AGE) <= 0;
        return new ClientInfo(height, height > 0 && fresh);
    }

    @Override
    public AddressInfo getAddress(final String address) {
        final JsonNode account;
        try {
            account = rest.get("/cosmos/auth/v1beta1/accounts/" + address).path("account");
        } catch (TransportException e) {
            if (e.hasStatus(404)) {
                return new AddressInfo(BigInteger.ZERO, false, 0L, null);
            }
            throw e;
        }
        // vesting accounts nest the base account
        final JsonNode base = account.has("base_account") ? account.path("base_account") : account;
        final BigInteger balance = getBalance(address, CoinInfo.mainCoin());
        final long sequence = RpcUtils.quantityOr(base.get("sequence"), BigInteger.ZERO).longValueExact();
        final BigInteger accountNumber = RpcUtils.quantity(base.get("account_number"));
        return new AddressInfo(
                balance, true, sequence, accountNumber == null ? null : accountNumber.longValueExact());
    }

    /**
     * Returns the balance of one denom; {@link CoinInfo#tokenAddress()} names
     * the denom, defaulting to {@code mainCoinDenom}.
     */
    @Override
    public BigInteger getBalance(final String address, final CoinInfo coin) {
        final String denom = coin.tokenAddress() != null ? coin.tokenAddress() : mainCoinDenom();
        final JsonNode balances = rest.get("/cosmos/bank/v1beta1/balances/" + address).path("balances");
        for (final JsonNode balance : balances) {
            if (denom.equals(balance.path("denom").asText())) {
                return RpcUtils.quantityOr(balance.get("amount"), BigInteger.ZERO);
            }
        }
        return BigInteger.ZERO;
    }

    @Override
    public TransactionStatus getTransactionStatus(final String txid) {
        final JsonNode tx;
        try {
            tx = rest.get("/cosmos/tx/v1beta1/txs/" + txid);
        } catch (TransportException e) {
            if (e.hasStatus(400) || e.hasStatus(404)) {
                return TransactionStatus.NOT_FOUND;
            }
            throw e;
        }
        final JsonNode response = tx.get("tx_response");
        if (response == null || response.isNull()) {
            return TransactionStatus.PENDING;
        }
        return response.path("code").asInt(0) == 0
                ? TransactionStatus.CONFIRM_AND_SUCCESS
                : TransactionStatus.CONFIRM_BUT_FAILED;
    }

    @Override
    public FeePricePerUnit getFeePricePerUnit() {
        final Map<String, Object> steps = chainInfo().mapOption("gasPriceStep");
        if (steps.isEmpty()) {
            return new FeePricePerUnit(
                    FeePrice.of(DEFAULT_NORMAL_GAS_PRICE),
                    List.of(FeePrice.of(DEFAULT_MIN_GAS_PRICE), FeePrice.of(DEFAULT_HIGH_GAS_PRICE)));
        }
        final BigDecimal normal = step(steps, "normal");
        final List<FeePrice> others = new ArrayList<>(2);
        for (final String level : List.of("min", "high")) {
            final BigDecimal price = step(steps, level);
            if (price != null) {
                others.add(FeePrice.of(price));
            }
        }
        return new FeePricePerUnit(
                normal == null ? FeePrice.of(DEFAULT_NORMAL_GAS_PRICE) : FeePrice.of(normal), others);
    }

    /**
     * Broadcasts in sync mode. A 400 answer is a rejection, not a node failure.
     */
    @Override
    public boolean broadcastTransaction(final String rawTx) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", BROADCAST_MODE_SYNC);
        body.put("tx_bytes", rawTx);
        final JsonNode response = rest.post("/cosmos/tx/v1beta1/txs", body, null, 400).path("tx_response");
        final String txhash = response.path("txhash").asText("");
        final JsonNode code = response.get("code");
        return !txhash.isEmpty() && (code == null || code.isNull() || code.asInt() == 0);
    }

    private String mainCoinDenom() {
        final String denom = chainInfo().stringOption("mainCoinDenom");
        if (denom == null) {
            throw new IllegalStateException("Chain " + chainInfo().code() + " has no mainCoinDenom option");
        }
        return denom;
    }

    private static @Nullable BigDecimal step(final Map<String, Object> steps, final String level) {
        final Object value = steps.get(level);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("gasPriceStep." + level + " is not numeric: " + value, e);
        }
    }

    private static @Nullable Instant blockTime(final @Nullable String time) {
        if (time == null || time.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(time);
        } catch (DateTimeParseException e) {
            throw new ProtocolException("Invalid block time: " + time, time, e);
        }
    }
}
