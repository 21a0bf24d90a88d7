package io.polychain.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when an HTTP exchange with a node does not produce a 2xx response.
 *
 * <p>
 * Status failures carry the status code and the raw response body, and their
 * message is always {@code Wrong response<STATUS>}. Network-level failures
 * (connection refused, timeout, interrupted exchange) carry neither.
 */
public final class TransportException extends PolychainException {

    private final @Nullable Integer statusCode;
    private final @Nullable String responseBody;

    public TransportException(
            final String message,
            final @Nullable Integer statusCode,
            final @Nullable String responseBody,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public TransportException(final String message, final Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates the exception for a non-2xx HTTP status.
     *
     * @param statusCode the HTTP status code
     * @param responseBody the raw response body, possibly empty
     * @return a new exception with message {@code Wrong response<statusCode>}
     */
    public static TransportException wrongResponse(final int statusCode, final @Nullable String responseBody) {
        return new TransportException("Wrong response<" + statusCode + ">", statusCode, responseBody, null);
    }

    public @Nullable Integer statusCode() {
        return statusCode;
    }

    public @Nullable String responseBody() {
        return responseBody;
    }

    public boolean hasStatus(final int status) {
        return statusCode != null && statusCode == status;
    }

    @Override
    public String toString() {
        return "TransportException{"
                + "message="
                + getMessage()
                + ", statusCode="
                + statusCode
                + "}";
    }
}
