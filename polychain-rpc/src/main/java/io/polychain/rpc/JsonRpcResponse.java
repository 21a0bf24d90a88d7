package io.polychain.rpc;

import static io.polychain.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.polychain.core.error.JsonRpcException;
import io.polychain.core.error.ProtocolException;
import io.polychain.rpc.internal.RpcUtils;
import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response object.
 * <p>
 * Parsed from a JSON tree rather than bound directly so that an explicit
 * {@code "result": null} can be told apart from a missing {@code result} key:
 * the first is a successful response whose {@link #result()} is a
 * {@code NullNode}, the second is a protocol violation.
 *
 * @param jsonrpc the protocol tag, if present
 * @param id the echoed request id, if present
 * @param result the result value, {@code null} only if the key was absent
 * @param error the error member, if present and not null
 */
public record JsonRpcResponse(
        @Nullable String jsonrpc,
        @Nullable JsonNode id,
        @Nullable JsonNode result,
        @Nullable JsonRpcError error) {

    /**
     * Builds a response view of one JSON object.
     *
     * @throws ProtocolException if the node is not a JSON object or its error member is malformed
     */
    public static JsonRpcResponse from(final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Invalid JSON RPC response, expected an object but got " + node);
        }
        final JsonNode errorNode = node.get("error");
        JsonRpcError error = null;
        if (errorNode != null && !errorNode.isNull()) {
            try {
                error = MAPPER.treeToValue(errorNode, JsonRpcError.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ProtocolException("Invalid JSON RPC error member", errorNode.toString(), e);
            }
        }
        final JsonNode version = node.get("jsonrpc");
        return new JsonRpcResponse(
                version == null || version.isNull() ? null : version.asText(),
                node.get("id"),
                node.get("result"),
                error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasResult() {
        return result != null;
    }

    /**
     * Applies the extraction rule: an error wins over any result, a missing
     * result is a protocol violation, anything else (JSON {@code null}
     * included) is returned as-is.
     *
     * @return the result node, a {@code NullNode} for an explicit null
     * @throws JsonRpcException if the response carries an error
     * @throws ProtocolException if the response carries no result
     */
    public JsonNode extractResult() {
        if (error != null) {
            throw new JsonRpcException(error.code(), error.message(), RpcUtils.errorData(error.data()));
        }
        if (result == null) {
            throw new ProtocolException("Invalid JSON RPC response, result not found");
        }
        return result;
    }
}
