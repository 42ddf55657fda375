// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.soulwire.primitives.Hex;

/**
 * Recoverable ECDSA signature over secp256k1.
 *
 * <p>
 * On the wire a signature is 65 bytes {@code r(32) || s(32) || v(1)} written as
 * {@code 0x}-prefixed hex. {@code v} is the y-parity of the signing point; the legacy
 * values 27 and 28 are accepted when parsing and normalized to 0 and 1.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature (low-s normalized when produced here)
 * @param v y-parity, 0 or 1
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of the wire encoding in bytes. */
    public static final int LENGTH = 65;

    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v != 0 && v != 1) {
            throw new IllegalArgumentException("v must be 0 or 1, got " + v);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses the 65-byte hex wire form.
     *
     * @param hex signature hex, with or without {@code 0x}
     * @return the signature
     * @throws IllegalArgumentException if the input is not 65 bytes of hex or v is invalid
     */
    public static Signature fromHex(final String hex) {
        final byte[] bytes = Hex.decodeExact(hex, LENGTH);
        int v = bytes[64] & 0xFF;
        if (v == 27 || v == 28) {
            v -= 27;
        }
        return new Signature(Arrays.copyOfRange(bytes, 0, 32), Arrays.copyOfRange(bytes, 32, 64), v);
    }

    /**
     * Lenient variant of {@link #fromHex(String)} for untrusted input.
     *
     * @return the parsed signature, or null when the token is malformed
     */
    public static Signature tryParse(final String hex) {
        if (hex == null) {
            return null;
        }
        try {
            return fromHex(hex);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Returns the 65-byte encoding {@code r || s || v}.
     */
    public byte[] toBytes() {
        final byte[] out = new byte[LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    /**
     * Returns the {@code 0x}-prefixed hex wire form.
     */
    public String toHex() {
        return Hex.encode(toBytes());
    }

    /**
     * Returns a copy of the r bytes.
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns a copy of the s bytes.
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}
