package io.polychain.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A transaction under construction.
 *
 * <p>
 * Callers supply inputs and outputs; a chain provider's
 * {@code buildUnsignedTx} fills in what it can look up from a node (nonce,
 * fee price, fee limit, chain-specific payload entries) and returns a new
 * instance. Instances are immutable: the {@code with...} methods copy.
 *
 * @param inputs sending side, usually a single entry
 * @param outputs receiving side, usually a single entry
 * @param nonce sender sequence number, looked up if absent
 * @param feeLimit maximum fee units (gas limit), looked up if absent
 * @param feePricePerUnit price per fee unit, looked up if absent
 * @param payload chain-specific extras carried into signing
 */
public record UnsignedTx(
        List<TxInput> inputs,
        List<TxOutput> outputs,
        @Nullable Long nonce,
        @Nullable BigDecimal feeLimit,
        @Nullable BigDecimal feePricePerUnit,
        Map<String, Object> payload) {

    public UnsignedTx {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static UnsignedTx of(final TxInput input, final TxOutput output) {
        return new UnsignedTx(List.of(input), List.of(output), null, null, null, Map.of());
    }

    public UnsignedTx withNonce(final @Nullable Long nonce) {
        return new UnsignedTx(inputs, outputs, nonce, feeLimit, feePricePerUnit, payload);
    }

    public UnsignedTx withFeeLimit(final @Nullable BigDecimal feeLimit) {
        return new UnsignedTx(inputs, outputs, nonce, feeLimit, feePricePerUnit, payload);
    }

    public UnsignedTx withFeePricePerUnit(final @Nullable BigDecimal feePricePerUnit) {
        return new UnsignedTx(inputs, outputs, nonce, feeLimit, feePricePerUnit, payload);
    }

    /**
     * Returns a copy whose payload also contains {@code key -> value}, replacing
     * any previous entry for the key.
     */
    public UnsignedTx withPayloadEntry(final String key, final Object value) {
        final Map<String, Object> merged = new LinkedHashMap<>(payload);
        merged.put(key, value);
        return new UnsignedTx(inputs, outputs, nonce, feeLimit, feePricePerUnit, merged);
    }

    public @Nullable TxInput firstInput() {
        return inputs.isEmpty() ? null : inputs.get(0);
    }

    public @Nullable TxOutput firstOutput() {
        return outputs.isEmpty() ? null : outputs.get(0);
    }
}
