package io.polychain.rpc;

import io.polychain.core.error.TransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * HTTP transport shared by {@link JsonRpcClient} and {@link RestfulClient}.
 *
 * <p>
 * Headers are merged in three layers, each overriding identical keys of the
 * one below:
 * <ol>
 * <li>built-in defaults ({@code User-Agent}, {@code Content-Type})</li>
 * <li>instance headers from {@link TransportConfig#headers()}</li>
 * <li>headers passed with the individual call</li>
 * </ol>
 *
 * <p>
 * Every request carries its own deadline. When it expires the exchange is
 * aborted and surfaces as a {@link TransportException}. Interrupting the
 * calling thread aborts the exchange the same way, which is how abandoned
 * readiness checks are cancelled.
 *
 * <p>
 * <strong>Thread Safety:</strong> instances are immutable and thread-safe.
 */
public final class HttpTransport {

    public static final Map<String, String> DEFAULT_HEADERS = Map.of(
            "User-Agent", "blockchain-libs",
            "Content-Type", "application/json");

    private final TransportConfig config;
    private final HttpClient httpClient;

    public HttpTransport(final TransportConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public TransportConfig config() {
        return config;
    }

    /**
     * Performs one HTTP exchange.
     *
     * @param method the HTTP method, {@code GET} or {@code POST}
     * @param url the absolute target URL
     * @param callHeaders per-call headers, highest precedence
     * @param body the request body, or {@code null} for none
     * @param timeout deadline for the whole exchange
     * @return the 2xx response
     * @throws TransportException on a non-2xx status, network failure, timeout or interrupt
     */
    public TransportResponse request(
            final String method,
            final String url,
            final @Nullable Map<String, String> callHeaders,
            final @Nullable String body,
            final Duration timeout) {
        final TransportResponse response = exchange(method, url, callHeaders, body, timeout);
        if (!response.isSuccess()) {
            throw TransportException.wrongResponse(response.statusCode(), response.body());
        }
        return response;
    }

    /**
     * Performs one HTTP exchange without classifying the status code.
     *
     * @throws TransportException on network failure, timeout or interrupt
     */
    public TransportResponse exchange(
            final String method,
            final String url,
            final @Nullable Map<String, String> callHeaders,
            final @Nullable String body,
            final Duration timeout) {
        final HttpRequest request = buildRequest(method, url, mergeHeaders(config.headers(), callHeaders), body, timeout);
        try {
            final HttpResponse<String> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new TransportResponse(response.statusCode(), response.body() == null ? "" : response.body());
        } catch (HttpTimeoutException e) {
            throw new TransportException("Request to " + url + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request to " + url + " was interrupted", e);
        } catch (IOException e) {
            throw new TransportException("Network error during request to " + url, e);
        }
    }

    /**
     * Merges header layers: defaults, then {@code instanceHeaders}, then
     * {@code callHeaders}. Later layers replace identical keys.
     *
     * @return a new mutable map in merge order
     */
    public static Map<String, String> mergeHeaders(
            final @Nullable Map<String, String> instanceHeaders,
            final @Nullable Map<String, String> callHeaders) {
        final Map<String, String> merged = new LinkedHashMap<>();
        merged.put("User-Agent", DEFAULT_HEADERS.get("User-Agent"));
        merged.put("Content-Type", DEFAULT_HEADERS.get("Content-Type"));
        if (instanceHeaders != null) {
            merged.putAll(instanceHeaders);
        }
        if (callHeaders != null) {
            merged.putAll(callHeaders);
        }
        return merged;
    }

    private static HttpRequest buildRequest(
            final String method,
            final String url,
            final Map<String, String> headers,
            final @Nullable String body,
            final Duration timeout) {
        final HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .method(method, publisher);

        for (Map.Entry<String, String> entry : headers.entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }
}
