package io.polychain.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Fee schedule of a chain: the recommended level plus alternatives.
 *
 * @param normal the recommended price level
 * @param others cheaper or faster alternatives, possibly empty
 */
public record FeePricePerUnit(FeePrice normal, List<FeePrice> others) {

    public FeePricePerUnit {
        Objects.requireNonNull(normal, "normal");
        others = others == null ? List.of() : List.copyOf(others);
    }

    public static FeePricePerUnit of(final FeePrice normal) {
        return new FeePricePerUnit(normal, List.of());
    }
}
