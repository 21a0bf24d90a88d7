package io.polychain.core.crypto;

/**
 * Holder of a public key, supplied by the key-handling layer of the
 * embedding application.
 */
public interface Verifier {

    /**
     * Returns the public key bytes.
     *
     * @param compressed whether the compressed point encoding is wanted, for curves that have one
     * @return the public key
     */
    byte[] getPubkey(boolean compressed);

    /**
     * Verifies a signature over a digest.
     *
     * @param digest the signed digest
     * @param signature the signature bytes
     * @return whether the signature matches this key
     */
    boolean verify(byte[] digest, byte[] signature);
}
