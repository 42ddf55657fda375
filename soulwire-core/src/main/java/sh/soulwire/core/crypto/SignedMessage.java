// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.util.Objects;

import sh.soulwire.core.identity.SoulId;

/**
 * A payload together with the soul that signed it and the signature.
 *
 * @param payload   signed text
 * @param signer    signing soul
 * @param signature signature over {@link SoulSigner#messageHash(String)} of the payload
 * @since 0.1.0
 */
public record SignedMessage(String payload, SoulId signer, Signature signature) {

    public SignedMessage {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(signature, "signature");
    }
}
