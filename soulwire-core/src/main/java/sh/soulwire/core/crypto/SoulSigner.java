// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.error.KeyUnavailableException;
import sh.soulwire.core.identity.IdentityRegistry;
import sh.soulwire.core.identity.Soul;
import sh.soulwire.core.identity.SoulId;

/**
 * Signs and verifies soul messages.
 *
 * <p>
 * The digest of a payload is
 * {@code keccak256("\x19Soul Signed Message:\n" + byteLength(payload) + payload)}, so a
 * soul signature can never be replayed as a signature over some other framing of
 * the same bytes. Signing is deterministic; verification is a pure function of
 * payload, signature and the signer's registered key and never throws on bad input.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Signature sig = SoulSigner.sign(privateKey, "hello");
 * boolean ok = signer.verify(SoulId.of("alice"), "hello", sig);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class SoulSigner {

    private static final Logger log = LoggerFactory.getLogger(SoulSigner.class);

    private static final byte[] PREFIX = "\u0019Soul Signed Message:\n".getBytes(StandardCharsets.UTF_8);

    private final IdentityRegistry registry;
    private final KeyCustody custody;

    public SoulSigner(final IdentityRegistry registry, final KeyCustody custody) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.custody = Objects.requireNonNull(custody, "custody");
    }

    /**
     * Computes the 32-byte digest that soul signatures cover.
     */
    public static byte[] messageHash(final byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        final byte[] length = Integer.toString(payload.length).getBytes(StandardCharsets.US_ASCII);
        return Keccak256.hash(PREFIX, length, payload);
    }

    public static byte[] messageHash(final String payload) {
        Objects.requireNonNull(payload, "payload");
        return messageHash(payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Signs a payload with an explicit key.
     */
    public static Signature sign(final PrivateKey key, final byte[] payload) {
        Objects.requireNonNull(key, "key");
        return key.sign(messageHash(payload));
    }

    public static Signature sign(final PrivateKey key, final String payload) {
        Objects.requireNonNull(key, "key");
        return key.sign(messageHash(payload));
    }

    /**
     * Signs a payload on behalf of a soul using the key held in custody.
     *
     * @throws KeyUnavailableException if custody holds no key for the soul
     */
    public Signature sign(final SoulId soul, final String payload) {
        final PrivateKey key = custody.keyFor(soul)
                .orElseThrow(() -> new KeyUnavailableException(soul.value()));
        return sign(key, payload);
    }

    /**
     * Builds a signed message on behalf of a soul.
     *
     * @throws KeyUnavailableException if custody holds no key for the soul
     */
    public SignedMessage signMessage(final SoulId soul, final String payload) {
        return new SignedMessage(payload, soul, sign(soul, payload));
    }

    /**
     * Verifies a signature against a soul's registered key.
     *
     * @return false if the soul is unknown, the signature is malformed or high-s, or
     *         the key does not match
     */
    public boolean verify(final SoulId soul, final String payload, final Signature signature) {
        if (soul == null || payload == null || signature == null) {
            return false;
        }
        return registry.find(soul)
                .map(Soul::key)
                .map(key -> verify(key, payload.getBytes(StandardCharsets.UTF_8), signature))
                .orElse(false);
    }

    public boolean verify(final SignedMessage message) {
        return message != null && verify(message.signer(), message.payload(), message.signature());
    }

    /**
     * Verifies a signature against an explicit public key.
     */
    public static boolean verify(final SoulKey key, final byte[] payload, final Signature signature) {
        if (key == null || payload == null || signature == null) {
            return false;
        }
        try {
            return Secp256k1.verify(messageHash(payload), signature, key.point());
        } catch (RuntimeException e) {
            log.debug("Signature verification failed on malformed input: {}", e.getMessage());
            return false;
        }
    }

    public static boolean verify(final SoulKey key, final String payload, final Signature signature) {
        return payload != null && verify(key, payload.getBytes(StandardCharsets.UTF_8), signature);
    }
}
