package io.polychain.rpc;

/**
 * Raw outcome of an HTTP exchange.
 *
 * @param statusCode the HTTP status
 * @param body the response body decoded as UTF-8, possibly empty
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
