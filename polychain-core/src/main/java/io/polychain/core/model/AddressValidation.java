package io.polychain.core.model;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of validating an address string for a chain.
 *
 * @param valid whether the address is acceptable
 * @param normalizedAddress canonical form used on the wire, when valid
 * @param displayAddress form shown to users, when valid
 * @param encoding chain-specific encoding tag, e.g. {@code "IMPLICIT_ACCOUNT"}
 */
public record AddressValidation(
        boolean valid,
        @Nullable String normalizedAddress,
        @Nullable String displayAddress,
        @Nullable String encoding) {

    private static final AddressValidation INVALID = new AddressValidation(false, null, null, null);

    public static AddressValidation valid(final String normalizedAddress, final String displayAddress) {
        return new AddressValidation(true, normalizedAddress, displayAddress, null);
    }

    public static AddressValidation invalid() {
        return INVALID;
    }
}
