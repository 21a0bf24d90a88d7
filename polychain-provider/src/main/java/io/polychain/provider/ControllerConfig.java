package io.polychain.provider;

import java.time.Duration;

/**
 * Client resolution settings of a {@link ProviderController}.
 *
 * @param readinessTimeout upper bound on one readiness race
 * @param cacheTtl how long a resolved client is trusted without racing again
 */
public record ControllerConfig(Duration readinessTimeout, Duration cacheTtl) {

    static final Duration DEFAULT_READINESS_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    public ControllerConfig {
        readinessTimeout = readinessTimeout == null ? DEFAULT_READINESS_TIMEOUT : readinessTimeout;
        cacheTtl = cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
        if (readinessTimeout.isNegative() || readinessTimeout.isZero()) {
            throw new IllegalArgumentException("readinessTimeout must be positive, got: " + readinessTimeout);
        }
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative, got: " + cacheTtl);
        }
    }

    public static ControllerConfig defaults() {
        return new ControllerConfig(DEFAULT_READINESS_TIMEOUT, DEFAULT_CACHE_TTL);
    }
}
