package io.polychain.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a node answers with a well-formed HTTP response whose payload
 * violates the JSON-RPC or REST contract.
 *
 * <p>
 * Typical causes: the body is not JSON, a JSON-RPC response has neither
 * {@code result} nor {@code error}, a batch response is not an array, or a
 * batch response has a different length than its request.
 */
public sealed class ProtocolException extends PolychainException permits JsonRpcException {

    private final @Nullable String responseBody;

    public ProtocolException(final String message) {
        this(message, null, null);
    }

    public ProtocolException(final String message, final @Nullable String responseBody, final @Nullable Throwable cause) {
        super(message, cause);
        this.responseBody = responseBody;
    }

    public @Nullable String responseBody() {
        return responseBody;
    }
}
