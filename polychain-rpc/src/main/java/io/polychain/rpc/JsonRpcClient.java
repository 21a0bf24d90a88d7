package io.polychain.rpc;

import static io.polychain.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.polychain.core.DebugLogger;
import io.polychain.core.LogFormatter;
import io.polychain.core.error.JsonRpcException;
import io.polychain.core.error.PolychainException;
import io.polychain.core.error.ProtocolException;
import io.polychain.core.error.TransportException;
import io.polychain.rpc.internal.RpcUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC 2.0 client over HTTP POST supporting single and batch calls.
 *
 * <p>
 * <strong>Ids:</strong> assigned per call, never from a shared counter. A
 * single call always uses id {@code 0}; a batch of N calls uses ids
 * {@code 0..N-1} in request order.
 *
 * <p>
 * <strong>Result extraction:</strong> an {@code error} member always fails
 * the call with {@link JsonRpcException}, even alongside a {@code result}. A
 * missing {@code result} fails with {@link ProtocolException}. An explicit
 * {@code "result": null} is a successful call returning a {@code NullNode}.
 *
 * <p>
 * <strong>Batches:</strong> the response must be a JSON array of exactly as
 * many elements as the request. Elements are correlated with requests by
 * position, not by echoed id.
 *
 * <p>
 * Nothing is retried; failures propagate to the caller untouched.
 *
 * <pre>{@code
 * JsonRpcClient rpc = JsonRpcClient.builder("https://node.example/rpc")
 *         .header("Authorization", "Bearer ...")
 *         .build();
 * JsonNode head = rpc.call("chain.info", List.of());
 * List<JsonNode> results = rpc.batchCall(List.of(
 *         RpcCall.of("txpool.pending_txn", txid),
 *         RpcCall.of("chain.get_transaction_info", txid)));
 * }</pre>
 */
public final class JsonRpcClient {

    private final HttpTransport transport;

    private JsonRpcClient(final HttpTransport transport) {
        this.transport = transport;
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static JsonRpcClient create(final String url) {
        return builder(url).build();
    }

    public TransportConfig config() {
        return transport.config();
    }

    public JsonNode call(final String method, final @Nullable Object params) {
        return call(method, params, (Map<String, String>) null);
    }

    /**
     * Sends a single request with id {@code 0}.
     *
     * @param method the method name
     * @param params positional ({@code List}) or named ({@code Map}) parameters
     * @param headers per-call headers, overriding instance and default headers
     * @return the result node; {@code NullNode} for an explicit null result
     * @throws TransportException on a non-2xx status or network failure
     * @throws JsonRpcException if the response carries an error
     * @throws ProtocolException if the response is malformed or has no result
     */
    public JsonNode call(final String method, final @Nullable Object params, final @Nullable Map<String, String> headers) {
        final JsonRpcRequest request = JsonRpcRequest.of(0L, method, params == null ? List.of() : params);

        final long start = System.nanoTime();
        try {
            final String body = post(RpcUtils.writeJson(request), headers);
            final JsonNode result = JsonRpcResponse.from(RpcUtils.readTree(body, method)).extractResult();
            DebugLogger.logRpc(() -> LogFormatter.formatRpc(method, micros(start)));
            return result;
        } catch (PolychainException e) {
            logFailure(method, e, start);
            throw e;
        }
    }

    /**
     * Sends a single request and converts the result with Jackson.
     *
     * @return the converted result, or {@code null} for an explicit null result
     * @throws ProtocolException if the result cannot be converted to {@code type}
     */
    public <T> @Nullable T call(final String method, final @Nullable Object params, final Class<T> type) {
        final JsonNode result = call(method, params);
        if (result.isNull()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(result, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException(
                    "Unable to map result of " + method + " to " + type.getSimpleName(), result.toString(), e);
        }
    }

    public List<JsonNode> batchCall(final List<RpcCall> calls) {
        return batchCall(calls, null);
    }

    /**
     * Sends a batch; any failing element fails the whole batch.
     *
     * @return results in request order
     * @throws TransportException on a non-2xx status or network failure
     * @throws JsonRpcException if any element carries an error
     * @throws ProtocolException if the response is not an array, has the wrong
     *         length, or any element has no result
     */
    public List<JsonNode> batchCall(final List<RpcCall> calls, final @Nullable Map<String, String> headers) {
        return batchCall(calls, headers, false);
    }

    /**
     * Sends a batch.
     *
     * <p>
     * With {@code ignoreSoloError} set, an element whose extraction fails
     * (error member or missing result) becomes a Java {@code null} at its
     * position instead of failing the batch; an explicit JSON null result is
     * still a {@code NullNode}. Array-shape and length violations always fail.
     *
     * @param calls the calls, in order
     * @param headers per-call headers
     * @param ignoreSoloError whether single-element failures map to {@code null}
     * @return results in request order, never shorter or longer than {@code calls}
     */
    public List<@Nullable JsonNode> batchCall(
            final List<RpcCall> calls,
            final @Nullable Map<String, String> headers,
            final boolean ignoreSoloError) {
        if (calls.isEmpty()) {
            return List.of();
        }
        final List<JsonRpcRequest> requests = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            final RpcCall call = calls.get(i);
            requests.add(JsonRpcRequest.of(i, call.method(), call.params()));
        }
        final String firstMethod = calls.get(0).method();

        final long start = System.nanoTime();
        final JsonNode responses;
        try {
            responses = RpcUtils.readTree(post(RpcUtils.writeJson(requests), headers), "batch");
            if (!responses.isArray()) {
                throw new ProtocolException(
                        "Invalid JSON Batch RPC response, response should be an array", responses.toString(), null);
            }
            if (responses.size() != calls.size()) {
                throw new ProtocolException(
                        "Invalid JSON Batch RPC response, batch with "
                                + calls.size()
                                + " calls, but got "
                                + responses.size()
                                + " responses",
                        responses.toString(),
                        null);
            }
        } catch (PolychainException e) {
            logFailure(firstMethod, e, start);
            throw e;
        }

        final List<@Nullable JsonNode> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            try {
                results.add(JsonRpcResponse.from(responses.get(i)).extractResult());
            } catch (ProtocolException e) {
                if (!ignoreSoloError) {
                    logFailure(calls.get(i).method(), e, start);
                    throw e;
                }
                final String failedMethod = calls.get(i).method();
                DebugLogger.logRpc(() -> LogFormatter.formatRpcError(
                        failedMethod, errorCode(e), e.getMessage(), micros(start)));
                results.add(null);
            }
        }
        DebugLogger.logRpc(() -> LogFormatter.formatBatch(calls.size(), firstMethod, micros(start)));
        return Collections.unmodifiableList(results);
    }

    private String post(final String payload, final @Nullable Map<String, String> headers) {
        final TransportConfig config = transport.config();
        return transport.request("POST", config.url(), headers, payload, config.readTimeout()).body();
    }

    private static void logFailure(final String method, final PolychainException e, final long start) {
        DebugLogger.logRpc(() -> LogFormatter.formatRpcError(method, errorCode(e), e.getMessage(), micros(start)));
    }

    private static @Nullable Object errorCode(final PolychainException e) {
        if (e instanceof JsonRpcException rpc) {
            return rpc.code();
        }
        if (e instanceof TransportException transportError) {
            return transportError.statusCode();
        }
        return null;
    }

    private static long micros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = TransportConfig.DEFAULT_CONNECT;
        private Duration readTimeout = TransportConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder headers(final Map<String, String> values) {
            if (values != null) {
                headers.putAll(values);
            }
            return this;
        }

        public JsonRpcClient build() {
            return new JsonRpcClient(
                    new HttpTransport(new TransportConfig(url, connectTimeout, readTimeout, headers)));
        }
    }
}
