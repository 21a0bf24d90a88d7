package io.polychain.core.error;

/**
 * Base runtime exception for all Polychain failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * PolychainException
 * ├── {@link TransportException} - non-2xx HTTP status, network failure or timeout
 * ├── {@link ProtocolException} - well-formed HTTP response carrying an invalid payload
 * │   └── {@link JsonRpcException} - the node answered with a JSON-RPC {@code error} member
 * ├── {@link NotImplementedException} - a chain module lacks an optional capability
 * └── {@link NoAvailableClientException} - no candidate client became ready in time
 * </pre>
 *
 * <p>
 * None of these are retried by the library; callers own their retry policy.
 *
 * <pre>{@code
 * try {
 *     controller.getBalances("STC", requests);
 * } catch (NoAvailableClientException e) {
 *     // every node for the chain is down or lagging
 * } catch (TransportException | ProtocolException e) {
 *     // the selected node misbehaved
 * }
 * }</pre>
 */
public sealed class PolychainException extends RuntimeException
        permits TransportException,
        ProtocolException,
        NotImplementedException,
        NoAvailableClientException {

    public PolychainException(final String message) {
        super(message);
    }

    public PolychainException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
