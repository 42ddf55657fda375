// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import sh.soulwire.core.TestSouls;

class PrivateKeyTest {

    private static final String GENERATOR_COMPRESSED =
            "0x0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";

    private static final String CURVE_ORDER =
            "fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141";

    @Test
    void keyOneDerivesGeneratorPoint() {
        assertEquals(GENERATOR_COMPRESSED, TestSouls.key(1).publicKey().toHex());
    }

    @Test
    void rejectsZeroKey() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x" + "00".repeat(32)));
    }

    @Test
    void rejectsKeyAtCurveOrder() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex(CURVE_ORDER));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x0102"));
    }

    @Test
    void zeroesInputBytes() {
        final byte[] bytes = new byte[32];
        bytes[31] = 7;
        PrivateKey.fromBytes(bytes);
        assertTrue(Arrays.equals(new byte[32], bytes));
    }

    @Test
    void destroyedKeyCannotSign() {
        final PrivateKey key = TestSouls.key(5);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.sign(new byte[32]));
        assertThrows(IllegalStateException.class, key::publicKey);
        assertEquals("PrivateKey[destroyed]", key.toString());
    }

    @Test
    void toStringShowsPublicKeyOnly() {
        final PrivateKey key = TestSouls.key(1);
        assertTrue(key.toString().contains(GENERATOR_COMPRESSED));
        assertFalse(key.toString().contains("0000000000000000000000000000000000000000000000000000000000000001"));
    }

    @Test
    void signRequires32ByteDigest() {
        assertThrows(IllegalArgumentException.class, () -> TestSouls.key(1).sign(new byte[31]));
    }
}
