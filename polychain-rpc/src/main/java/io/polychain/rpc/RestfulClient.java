package io.polychain.rpc;

import static io.polychain.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.databind.JsonNode;
import io.polychain.core.DebugLogger;
import io.polychain.core.LogFormatter;
import io.polychain.core.error.ProtocolException;
import io.polychain.core.error.TransportException;
import io.polychain.rpc.internal.RpcUtils;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON REST client for node APIs such as the Cosmos SDK gateway.
 *
 * <p>
 * Paths are appended to the base URL. Header merging and status
 * classification follow {@link HttpTransport}: any non-2xx status fails with
 * {@link TransportException} ({@code Wrong response<STATUS>}), unless the
 * caller names it as the tolerated status, in which case the parsed error
 * body is returned instead. Chain clients use this to tell an expected
 * "not found" or "rejected" answer apart from a broken node.
 *
 * <pre>{@code
 * RestfulClient rest = RestfulClient.builder("https://lcd.example").build();
 * JsonNode balances = rest.get("/cosmos/bank/v1beta1/balances/" + address);
 * JsonNode rejected = rest.post("/cosmos/tx/v1beta1/txs", body, null, 400);
 * }</pre>
 */
public final class RestfulClient {

    private final HttpTransport transport;

    private RestfulClient(final HttpTransport transport) {
        this.transport = transport;
    }

    public static Builder builder(final String baseUrl) {
        return new Builder(baseUrl);
    }

    public TransportConfig config() {
        return transport.config();
    }

    public JsonNode get(final String path) {
        return get(path, null, null);
    }

    public JsonNode get(final String path, final @Nullable Map<String, String> headers) {
        return get(path, headers, null);
    }

    /**
     * Issues a GET.
     *
     * @param path path appended to the base URL
     * @param headers per-call headers
     * @param toleratedStatus a non-2xx status whose body is returned rather than thrown
     * @return the parsed body
     * @throws TransportException on any other non-2xx status or network failure
     * @throws ProtocolException if a 2xx body is not JSON
     */
    public JsonNode get(
            final String path,
            final @Nullable Map<String, String> headers,
            final @Nullable Integer toleratedStatus) {
        return send("GET", path, null, headers, toleratedStatus);
    }

    public JsonNode post(final String path, final Object body) {
        return post(path, body, null, null);
    }

    public JsonNode post(final String path, final Object body, final @Nullable Map<String, String> headers) {
        return post(path, body, headers, null);
    }

    /**
     * Issues a POST with a JSON body.
     *
     * @param path path appended to the base URL
     * @param body the payload, serialized with Jackson
     * @param headers per-call headers
     * @param toleratedStatus a non-2xx status whose body is returned rather than thrown
     * @return the parsed body
     * @throws TransportException on any other non-2xx status or network failure
     * @throws ProtocolException if a 2xx body is not JSON
     */
    public JsonNode post(
            final String path,
            final Object body,
            final @Nullable Map<String, String> headers,
            final @Nullable Integer toleratedStatus) {
        return send("POST", path, RpcUtils.writeJson(body), headers, toleratedStatus);
    }

    private JsonNode send(
            final String method,
            final String path,
            final @Nullable String payload,
            final @Nullable Map<String, String> headers,
            final @Nullable Integer toleratedStatus) {
        final TransportConfig config = transport.config();
        final long start = System.nanoTime();
        final TransportResponse response;
        try {
            response = transport.exchange(method, resolve(config.url(), path), headers, payload, config.readTimeout());
        } catch (TransportException e) {
            DebugLogger.logRpc(() -> LogFormatter.formatRpcError(
                    method + " " + path, null, e.getMessage(), micros(start)));
            throw e;
        }
        DebugLogger.logRpc(() -> LogFormatter.formatRest(method, path, response.statusCode(), micros(start)));

        if (response.isSuccess()) {
            return RpcUtils.readTree(response.body(), method + " " + path);
        }
        if (toleratedStatus != null && toleratedStatus == response.statusCode()) {
            return lenientTree(response.body());
        }
        throw TransportException.wrongResponse(response.statusCode(), response.body());
    }

    private static JsonNode lenientTree(final String body) {
        if (body == null || body.isBlank()) {
            return MAPPER.getNodeFactory().textNode("");
        }
        try {
            return RpcUtils.readTree(body, "error body");
        } catch (ProtocolException e) {
            return MAPPER.getNodeFactory().textNode(body);
        }
    }

    static String resolve(final String baseUrl, final String path) {
        if (path.isEmpty()) {
            return baseUrl;
        }
        final boolean baseSlash = baseUrl.endsWith("/");
        final boolean pathSlash = path.startsWith("/");
        if (baseSlash && pathSlash) {
            return baseUrl + path.substring(1);
        }
        if (!baseSlash && !pathSlash) {
            return baseUrl + "/" + path;
        }
        return baseUrl + path;
    }

    private static long micros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }

    public static final class Builder {
        private final String baseUrl;
        private Duration connectTimeout = TransportConfig.DEFAULT_CONNECT;
        private Duration readTimeout = TransportConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String baseUrl) {
            this.baseUrl = baseUrl;
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

        public RestfulClient build() {
            return new RestfulClient(
                    new HttpTransport(new TransportConfig(baseUrl, connectTimeout, readTimeout, headers)));
        }
    }
}
