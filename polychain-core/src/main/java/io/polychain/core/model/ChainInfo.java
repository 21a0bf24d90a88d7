package io.polychain.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Static description of one chain as supplied by the embedding application.
 *
 * <p>
 * A {@code ChainInfo} is bound to every client and provider built for the
 * chain and never changes afterwards.
 *
 * @param code the chain code callers use to address the chain, e.g. {@code "STC"}
 * @param impl the implementation identifier resolved through the chain registry
 * @param clients ordered candidate client configurations
 * @param implOptions chain-specific options such as address prefixes or fee steps
 */
public record ChainInfo(
        String code,
        String impl,
        List<ClientConfig> clients,
        Map<String, Object> implOptions) {

    public ChainInfo {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(impl, "impl");
        clients = clients == null ? List.of() : List.copyOf(clients);
        implOptions = implOptions == null ? Map.of() : freezeMap(implOptions);
    }

    public ChainInfo(final String code, final String impl, final List<ClientConfig> clients) {
        this(code, impl, clients, Map.of());
    }

    public @Nullable Object option(final String key) {
        return implOptions.get(key);
    }

    public @Nullable String stringOption(final String key) {
        final Object value = implOptions.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Returns a numeric option, accepting both numbers and numeric strings.
     *
     * @throws IllegalArgumentException if the option is present but not numeric
     */
    public @Nullable BigDecimal decimalOption(final String key) {
        return toDecimal(key, implOptions.get(key));
    }

    /**
     * Returns a nested option bag, or an empty map if the option is absent.
     *
     * @throws IllegalArgumentException if the option is present but not a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> mapOption(final String key) {
        final Object value = implOptions.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new IllegalArgumentException("Option " + key + " of chain " + code + " is not a map: " + value);
    }

    // Nested maps and lists are copied all the way down; options may hold null values.
    private static Map<String, Object> freezeMap(final Map<?, ?> source) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static @Nullable Object freeze(final @Nullable Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            final List<@Nullable Object> copy = new ArrayList<>(list.size());
            for (final Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    static @Nullable BigDecimal toDecimal(final String key, final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Option " + key + " is not numeric: " + value, e);
            }
        }
        throw new IllegalArgumentException("Option " + key + " is not numeric: " + value);
    }
}
