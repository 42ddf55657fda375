// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import sh.soulwire.primitives.Hex;

/**
 * secp256k1 private key held by a key custodian.
 *
 * <p>
 * Soulwire never generates or stores client keys; instances exist only inside a
 * {@link KeyCustody} implementation or in client tooling. Signing is deterministic
 * (RFC 6979) and low-s normalized.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x1234...");
 * SoulKey publicKey = key.publicKey();
 * Signature sig = SoulSigner.sign(key, "hello");
 * }</pre>
 *
 * <p>
 * Implements {@link Destroyable}: after {@link #destroy()} every operation throws
 * {@link IllegalStateException}. BigInteger is immutable, so the scalar cannot be
 * zeroed in place; destroying drops the references.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;

    private volatile BigInteger privateKeyValue;
    private volatile SoulKey publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);
            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(Secp256k1.CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.publicKey = SoulKey.of(Secp256k1.publicPoint(privateKeyValue));
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if hex string is invalid or key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Creates a private key from raw bytes. The input array is zeroed afterwards.
     *
     * @param keyBytes 32-byte private key (will be zeroed after use)
     * @return private key instance
     * @throws IllegalArgumentException if key bytes are invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Returns the matching public verification key.
     *
     * @throws IllegalStateException if the key has been destroyed
     */
    public SoulKey publicKey() {
        synchronized (this) {
            checkNotDestroyed();
            return publicKey;
        }
    }

    /**
     * Signs a 32-byte digest.
     *
     * @param messageHash 32-byte digest, normally from {@link SoulSigner#messageHash(byte[])}
     * @return low-s signature with v = 0 or 1
     * @throws IllegalArgumentException if the digest is not 32 bytes
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return Secp256k1.sign(messageHash, key);
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Never includes key material; shows the public key instead.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[publicKey=" + publicKey().toHex() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
