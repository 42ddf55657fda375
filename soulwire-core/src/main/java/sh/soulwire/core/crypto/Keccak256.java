// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 digest used for soul message hashes.
 *
 * <p>
 * Digest instances are cached per thread. Netty event-loop threads and the
 * sweeper thread live for the whole process, so the cache never needs clearing
 * in a running node; {@link #cleanup()} exists for embedders running on pooled
 * threads they do not own.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 hash of several arrays as if they were concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Removes the cached digest instance from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
