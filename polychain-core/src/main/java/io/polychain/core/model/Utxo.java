package io.polychain.core.model;

import java.math.BigInteger;

/**
 * An unspent transaction output.
 *
 * @param txid id of the transaction that created the output
 * @param vout index of the output within that transaction
 * @param value output value in the smallest coin unit
 */
public record Utxo(String txid, int vout, BigInteger value) {}
