package io.polychain.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable map from implementation identifier to chain module.
 *
 * <pre>{@code
 * ChainRegistry registry = ChainRegistry.builder()
 *         .register(new StcImplementation())
 *         .register(new CosmosImplementation())
 *         .build();
 * }</pre>
 */
public final class ChainRegistry {

    private final Map<String, ChainImplementation> implementations;

    private ChainRegistry(final Map<String, ChainImplementation> implementations) {
        this.implementations = Collections.unmodifiableMap(new LinkedHashMap<>(implementations));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException if no module is registered under {@code impl}
     */
    public ChainImplementation require(final String impl) {
        final ChainImplementation implementation = implementations.get(impl);
        if (implementation == null) {
            throw new IllegalArgumentException(
                    "Unknown chain implementation: " + impl + " (registered: " + implementations.keySet() + ")");
        }
        return implementation;
    }

    public boolean contains(final String impl) {
        return implementations.containsKey(impl);
    }

    public Set<String> ids() {
        return implementations.keySet();
    }

    public static final class Builder {
        private final Map<String, ChainImplementation> implementations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the id is already registered
         */
        public Builder register(final ChainImplementation implementation) {
            Objects.requireNonNull(implementation, "implementation");
            final ChainImplementation previous = implementations.putIfAbsent(implementation.id(), implementation);
            if (previous != null) {
                throw new IllegalArgumentException("Chain implementation already registered: " + implementation.id());
            }
            return this;
        }

        public ChainRegistry build() {
            return new ChainRegistry(implementations);
        }
    }
}
