package io.polychain.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SignatureTest {

    @Test
    void bytesAreCopied() {
        byte[] raw = {1, 2, 3};
        Signature signature = new Signature(raw, 1);
        raw[0] = 9;
        signature.bytes()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, signature.bytes());
    }

    @Test
    void equalityByContent() {
        Signature a = new Signature(new byte[] {0x0a, 0x0b}, 0);
        Signature b = new Signature(new byte[] {0x0a, 0x0b}, 0);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.toString().contains("0x0a0b"));
    }
}
