package io.polychain.core.model;

import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Receiving side of a transfer.
 */
public record TxOutput(String address, BigInteger value, @Nullable String tokenAddress) {

    public TxOutput {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(value, "value");
    }
}
