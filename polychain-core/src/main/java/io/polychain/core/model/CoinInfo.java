package io.polychain.core.model;

import org.jspecify.annotations.Nullable;

/**
 * Partial coin description used to qualify balance queries.
 *
 * <p>
 * Every field is optional. A missing {@code tokenAddress} means the chain's
 * main coin.
 */
public record CoinInfo(
        @Nullable String code,
        @Nullable String chainCode,
        @Nullable Integer decimals,
        @Nullable String tokenAddress) {

    private static final CoinInfo MAIN = new CoinInfo(null, null, null, null);

    public static CoinInfo mainCoin() {
        return MAIN;
    }

    public static CoinInfo token(final String tokenAddress) {
        return new CoinInfo(null, null, null, tokenAddress);
    }
}
