package io.polychain.core.model;

import java.math.BigDecimal;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single fee price level.
 *
 * @param price price per fee unit (gas, byte, ...) in the smallest coin unit
 * @param waitingBlock expected number of blocks before inclusion, if known
 */
public record FeePrice(BigDecimal price, @Nullable Integer waitingBlock) {

    public FeePrice {
        Objects.requireNonNull(price, "price");
    }

    public static FeePrice of(final long price) {
        return new FeePrice(BigDecimal.valueOf(price), null);
    }

    public static FeePrice of(final BigDecimal price) {
        return new FeePrice(price, null);
    }
}
