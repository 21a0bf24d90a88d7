package io.polychain.core.crypto;

/**
 * Signing capability over a private key the library never sees.
 *
 * <p>
 * Key custody stays with the embedding application; chain providers only
 * hand digests to {@link #sign(byte[])}.
 */
public interface Signer extends Verifier {

    /**
     * Signs a digest.
     *
     * @param digest the message digest to sign
     * @return the signature and its recovery id
     */
    Signature sign(byte[] digest);
}
