package io.polychain.rpc;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings shared by the JSON-RPC and REST engines.
 *
 * @param url the node endpoint; for REST, the base URL paths are appended to
 * @param connectTimeout TCP connect timeout
 * @param readTimeout per-request deadline after which the exchange is aborted
 * @param headers instance headers, applied above the built-in defaults and below per-call headers
 */
public record TransportConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public TransportConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static TransportConfig withDefaults(final String url) {
        return new TransportConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
