package io.polychain.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the readiness race for a chain produces no ready client.
 *
 * <p>
 * Either every candidate reported itself not ready, every candidate failed,
 * the pool was empty, or the readiness timeout elapsed first. This is terminal
 * for the resolution that raised it: the controller never retries on its own.
 */
public final class NoAvailableClientException extends PolychainException {

    private final String chainCode;

    public NoAvailableClientException(final String chainCode, final @Nullable Throwable lastFailure) {
        super("No available client", lastFailure);
        this.chainCode = chainCode;
    }

    public String chainCode() {
        return chainCode;
    }
}
