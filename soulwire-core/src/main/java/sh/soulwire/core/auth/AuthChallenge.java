// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.auth;

import java.time.Instant;
import java.util.Objects;

import sh.soulwire.core.identity.SoulId;

/**
 * Outstanding authentication challenge. The client proves key possession by
 * signing the UTF-8 bytes of {@code nonce} exactly as sent on the wire.
 *
 * @param challengeId unique id of this challenge
 * @param soulId      the soul the challenge was issued for
 * @param nonce       32 random bytes, {@code 0x}-prefixed hex
 * @param issuedAt    issue time
 * @param expiresAt   time after which the challenge cannot be answered
 * @since 0.1.0
 */
public record AuthChallenge(String challengeId, SoulId soulId, String nonce, Instant issuedAt, Instant expiresAt) {

    public AuthChallenge {
        Objects.requireNonNull(challengeId, "challengeId");
        Objects.requireNonNull(soulId, "soulId");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * A challenge is expired from {@code expiresAt} onwards.
     */
    public boolean isExpired(final Instant now) {
        return !now.isBefore(expiresAt);
    }
}
