package io.polychain.chains.cosmos;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Bech32 (BIP-173) decoding and encoding of Cosmos addresses.
 */
final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final int CHECKSUM_LENGTH = 6;
    private static final int MAX_LENGTH = 90;

    private Bech32() {
        // Utility class - prevent instantiation
    }

    /**
     * A decoded address: human-readable part and 8-bit payload.
     */
    record Decoded(String hrp, byte[] data) {}

    /**
     * Decodes a bech32 string.
     *
     * @return the decoded parts, or {@code null} if the string is not valid bech32
     */
    static @Nullable Decoded decode(final String value) {
        if (value == null || value.length() < 8 || value.length() > MAX_LENGTH) {
            return null;
        }
        final String lower = value.toLowerCase(Locale.ROOT);
        if (!value.equals(lower) && !value.equals(value.toUpperCase(Locale.ROOT))) {
            return null;
        }
        final int separator = lower.lastIndexOf('1');
        if (separator < 1 || separator + CHECKSUM_LENGTH + 1 > lower.length()) {
            return null;
        }
        final String hrp = lower.substring(0, separator);
        for (int i = 0; i < hrp.length(); i++) {
            final char c = hrp.charAt(i);
            if (c < 33 || c > 126) {
                return null;
            }
        }
        final byte[] values = new byte[lower.length() - separator - 1];
        for (int i = 0; i < values.length; i++) {
            final int index = CHARSET.indexOf(lower.charAt(separator + 1 + i));
            if (index < 0) {
                return null;
            }
            values[i] = (byte) index;
        }
        if (polymod(hrp, values) != 1) {
            return null;
        }
        final byte[] data = convertBits(Arrays.copyOf(values, values.length - CHECKSUM_LENGTH), 5, 8, false);
        return data == null ? null : new Decoded(hrp, data);
    }

    static String encode(final String hrp, final byte[] data) {
        final byte[] values = convertBits(data, 8, 5, true);
        final String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        final byte[] withChecksum = Arrays.copyOf(values, values.length + CHECKSUM_LENGTH);
        final int mod = polymod(lowerHrp, withChecksum) ^ 1;
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            withChecksum[values.length + i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        final StringBuilder sb = new StringBuilder(lowerHrp).append('1');
        for (final byte b : withChecksum) {
            sb.append(CHARSET.charAt(b));
        }
        return sb.toString();
    }

    private static int polymod(final String hrp, final byte[] values) {
        int chk = 1;
        for (int i = 0; i < hrp.length(); i++) {
            chk = step(chk, hrp.charAt(i) >> 5);
        }
        chk = step(chk, 0);
        for (int i = 0; i < hrp.length(); i++) {
            chk = step(chk, hrp.charAt(i) & 31);
        }
        for (final byte v : values) {
            chk = step(chk, v);
        }
        return chk;
    }

    private static int step(final int chk, final int value) {
        final int top = chk >>> 25;
        int next = ((chk & 0x1ffffff) << 5) ^ value;
        for (int i = 0; i < 5; i++) {
            if (((top >>> i) & 1) == 1) {
                next ^= GENERATOR[i];
            }
        }
        return next;
    }

    // returns null when padding is invalid and pad is false
    private static byte @Nullable [] convertBits(final byte[] data, final int from, final int to, final boolean pad) {
        int acc = 0;
        int bits = 0;
        final int maxValue = (1 << to) - 1;
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (final byte b : data) {
            final int value = b & 0xff;
            if ((value >>> from) != 0) {
                return null;
            }
            acc = (acc << from) | value;
            bits += from;
            while (bits >= to) {
                bits -= to;
                out.write((acc >>> bits) & maxValue);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (to - bits)) & maxValue);
            }
        } else if (bits >= from || ((acc << (to - bits)) & maxValue) != 0) {
            return null;
        }
        return out.toByteArray();
    }
}
