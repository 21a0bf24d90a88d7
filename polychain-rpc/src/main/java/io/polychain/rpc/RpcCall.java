package io.polychain.rpc;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a JSON-RPC batch.
 *
 * @param method the method name
 * @param params positional ({@code List}) or named ({@code Map}) parameters
 */
public record RpcCall(String method, Object params) {

    public RpcCall {
        Objects.requireNonNull(method, "method");
        params = params == null ? List.of() : params;
    }

    public static RpcCall of(final String method, final Object... params) {
        return new RpcCall(method, List.of(params));
    }
}
