package io.polychain.core.model;

import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * On-chain state of an address.
 *
 * @param balance balance of the chain's main coin in its smallest unit
 * @param existing whether the account exists on chain
 * @param nonce next sequence number, if the chain has one
 * @param accountNumber account number, for chains that assign one (Cosmos)
 */
public record AddressInfo(
        BigInteger balance,
        boolean existing,
        @Nullable Long nonce,
        @Nullable Long accountNumber) {

    public AddressInfo {
        Objects.requireNonNull(balance, "balance");
    }

    public AddressInfo(final BigInteger balance, final boolean existing, final @Nullable Long nonce) {
        this(balance, existing, nonce, null);
    }
}
