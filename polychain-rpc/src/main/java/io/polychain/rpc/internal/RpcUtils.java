package io.polychain.rpc.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.polychain.core.error.ProtocolException;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * Internal utility methods for JSON handling across the RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API. Chain
 * modules may use the quantity helpers, nothing else should rely on it.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a response body into a JSON tree.
     *
     * @throws ProtocolException if the body is not valid JSON
     */
    public static JsonNode readTree(final String body, final String context) {
        try {
            final JsonNode node = MAPPER.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new ProtocolException("Empty response for " + context, body, null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Unable to parse response for " + context, body, e);
        }
    }

    /**
     * Serializes a request payload.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public static String writeJson(final Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request payload", e);
        }
    }

    /**
     * Flattens a JSON-RPC error {@code data} member into a string.
     */
    public static @Nullable String errorData(final @Nullable JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return null;
        }
        return data.isTextual() ? data.asText() : data.toString();
    }

    /**
     * Reads a quantity that nodes may encode as a JSON number, a decimal
     * string or a {@code 0x}-prefixed hex string.
     *
     * @return the quantity, or {@code null} if the node is absent or null
     * @throws ProtocolException if the value is not a quantity
     */
    public static @Nullable BigInteger quantity(final @Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue().toBigInteger();
        }
        final String text = node.asText().trim();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return new BigInteger(text.substring(2), 16);
            }
            return new BigDecimal(text).toBigInteger();
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid quantity: " + text, node.toString(), e);
        }
    }

    /**
     * Like {@link #quantity(JsonNode)} but falls back to {@code defaultValue}.
     */
    public static BigInteger quantityOr(final @Nullable JsonNode node, final BigInteger defaultValue) {
        final BigInteger value = quantity(node);
        return value == null ? defaultValue : value;
    }
}
