// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Curve arithmetic for secp256k1: deterministic signing, verification and point codecs.
 *
 * <p>
 * Signing follows RFC 6979 with the recovery parity computed directly from
 * {@code R = k*G}. Signatures are normalized to low-s, and verification rejects
 * high-s values so every (key, message) pair has exactly one valid encoding.
 *
 * <p>
 * Thread-safe: the shared {@link FixedPointCombMultiplier} keeps no mutable state
 * and each call builds its own {@link HMacDSAKCalculator}.
 */
final class Secp256k1 {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1() {
    }

    /**
     * Computes the public point {@code d*G}.
     */
    static ECPoint publicPoint(final BigInteger privateKey) {
        return MULTIPLIER.multiply(CURVE.getG(), privateKey).normalize();
    }

    /**
     * Decodes a compressed (33-byte) or uncompressed (65-byte) SEC1 point.
     *
     * @throws IllegalArgumentException if the bytes are not a valid curve point
     */
    static ECPoint decodePoint(final byte[] encoded) {
        if (encoded.length != 33 && encoded.length != 65) {
            throw new IllegalArgumentException("Public key must be 33 or 65 bytes, got " + encoded.length);
        }
        final ECPoint point;
        try {
            point = CURVE.getCurve().decodePoint(encoded);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Public key is not a secp256k1 point", e);
        }
        if (point.isInfinity() || !point.isValid()) {
            throw new IllegalArgumentException("Public key is not a valid secp256k1 point");
        }
        return point.normalize();
    }

    /**
     * Signs a 32-byte digest.
     *
     * @return low-s signature with v = y-parity of R (0 or 1)
     */
    static Signature sign(final byte[] messageHash, final BigInteger privateKey) {
        final BigInteger n = CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, privateKey, messageHash);
        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

            // Negating s corresponds to -R, which flips the y parity.
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                v ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), v);
        }
    }

    /**
     * Verifies a signature over a 32-byte digest against a public point.
     * Returns false for out-of-range or high-s components.
     */
    static boolean verify(final byte[] messageHash, final Signature signature, final ECPoint publicKey) {
        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        final BigInteger n = CURVE.getN();
        if (r.signum() <= 0 || r.compareTo(n) >= 0) {
            return false;
        }
        if (s.signum() <= 0 || s.compareTo(HALF_CURVE_ORDER) > 0) {
            return false;
        }
        final ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(publicKey, CURVE));
        return verifier.verifySignature(messageHash, r, s);
    }

    static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // Drop the sign byte BigInteger adds for values with the top bit set.
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
