// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.util.Arrays;

import org.bouncycastle.math.ec.ECPoint;

import sh.soulwire.primitives.Hex;

/**
 * A soul's public verification key: a secp256k1 point kept in 33-byte compressed form.
 *
 * <p>
 * Parsing accepts compressed or uncompressed SEC1 encodings and always normalizes to
 * the compressed form, so two encodings of the same point compare equal.
 *
 * @since 0.1.0
 */
public final class SoulKey {

    private final byte[] compressed;
    private final ECPoint point;

    private SoulKey(final ECPoint point) {
        this.point = point;
        this.compressed = point.getEncoded(true);
    }

    static SoulKey of(final ECPoint point) {
        return new SoulKey(point.normalize());
    }

    /**
     * Parses a public key from raw SEC1 bytes.
     *
     * @throws IllegalArgumentException if the bytes are not a point on the curve
     */
    public static SoulKey fromBytes(final byte[] encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("public key cannot be null");
        }
        return new SoulKey(Secp256k1.decodePoint(encoded));
    }

    /**
     * Parses a public key from hex.
     *
     * @throws IllegalArgumentException if the token is not hex or not a point on the curve
     */
    public static SoulKey fromHex(final String hex) {
        return fromBytes(Hex.decode(hex));
    }

    /**
     * Returns a copy of the 33-byte compressed encoding.
     */
    public byte[] toBytes() {
        return Arrays.copyOf(compressed, compressed.length);
    }

    /**
     * Returns the compressed encoding as {@code 0x}-prefixed hex.
     */
    public String toHex() {
        return Hex.encode(compressed);
    }

    ECPoint point() {
        return point;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof SoulKey other && Arrays.equals(compressed, other.compressed);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(compressed);
    }

    @Override
    public String toString() {
        return "SoulKey[" + toHex() + "]";
    }
}
