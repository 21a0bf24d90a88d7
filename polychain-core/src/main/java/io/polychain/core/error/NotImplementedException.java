package io.polychain.core.error;

/**
 * Thrown when a chain module does not support an optional capability, such
 * as token metadata, UTXO lookup or message signing.
 */
public final class NotImplementedException extends PolychainException {

    private final String capability;

    public NotImplementedException(final String capability) {
        super("Not implemented: " + capability);
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
