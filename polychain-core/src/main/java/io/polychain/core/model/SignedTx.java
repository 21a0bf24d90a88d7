package io.polychain.core.model;

/**
 * A signed transaction ready for broadcast.
 *
 * @param txid the transaction id
 * @param rawTx the chain-specific serialized form passed to {@code broadcastTransaction}
 */
public record SignedTx(String txid, String rawTx) {}
