package io.polychain.core.model;

import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Sending side of a transfer.
 */
public record TxInput(String address, BigInteger value, @Nullable String tokenAddress) {

    public TxInput {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(value, "value");
    }
}
