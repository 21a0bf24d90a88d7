package io.polychain.core.model;

/**
 * Lifecycle state of a submitted transaction.
 */
public enum TransactionStatus {
    NOT_FOUND(-1),
    PENDING(0),
    INVALID(1),
    CONFIRM_AND_SUCCESS(10),
    CONFIRM_BUT_FAILED(11);

    private final int code;

    TransactionStatus(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isConfirmed() {
        return this == CONFIRM_AND_SUCCESS || this == CONFIRM_BUT_FAILED;
    }
}
