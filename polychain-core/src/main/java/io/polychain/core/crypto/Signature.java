package io.polychain.core.crypto;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Raw signature bytes with the recovery id used by recoverable schemes.
 *
 * @param bytes the signature
 * @param recoveryId recovery id, or {@code 0} for schemes without one
 */
public record Signature(byte[] bytes, int recoveryId) {

    public Signature {
        Objects.requireNonNull(bytes, "bytes");
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signature other)) {
            return false;
        }
        return recoveryId == other.recoveryId && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + recoveryId;
    }

    @Override
    public String toString() {
        return "Signature{bytes=0x" + HexFormat.of().formatHex(bytes) + ", recoveryId=" + recoveryId + "}";
    }
}
