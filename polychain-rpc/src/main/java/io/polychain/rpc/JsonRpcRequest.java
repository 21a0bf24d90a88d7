package io.polychain.rpc;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A JSON-RPC 2.0 request envelope.
 *
 * <p>
 * The id is assigned per call: {@code 0} for a single request and the
 * zero-based position for batch entries.
 */
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JsonRpcRequest(String jsonrpc, long id, String method, Object params) {

    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(final long id, final String method, final Object params) {
        return new JsonRpcRequest(VERSION, id, method, params);
    }
}
