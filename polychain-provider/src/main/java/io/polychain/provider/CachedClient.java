package io.polychain.provider;

import java.time.Instant;
import java.util.Objects;

/**
 * The last client resolved for a chain and when it stops being trusted.
 * Replaced wholesale on every successful resolution.
 */
record CachedClient(ChainClient client, Instant expiresAt) {

    CachedClient {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    boolean isFresh(final Instant now) {
        return now.isBefore(expiresAt);
    }
}
