package io.polychain.core.model;

import java.util.Objects;

/**
 * One balance lookup: which address, for which coin.
 */
public record BalanceRequest(String address, CoinInfo coin) {

    public BalanceRequest {
        Objects.requireNonNull(address, "address");
        coin = coin == null ? CoinInfo.mainCoin() : coin;
    }

    public static BalanceRequest of(final String address) {
        return new BalanceRequest(address, CoinInfo.mainCoin());
    }
}
