// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.auth;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.soulwire.core.identity.Soul;

/**
 * Outcome of answering a challenge.
 *
 * @param status   outcome
 * @param soul     the bound soul when authenticated
 * @param replaced the soul this session was bound to before, when re-authentication
 *                 switched it to a different soul
 * @since 0.1.0
 */
public record AuthResult(Status status, @Nullable Soul soul, @Nullable Soul replaced) {

    public enum Status {
        AUTHENTICATED,
        AUTH_FAILED,
        CHALLENGE_EXPIRED
    }

    public AuthResult {
        Objects.requireNonNull(status, "status");
        if (status == Status.AUTHENTICATED && soul == null) {
            throw new IllegalArgumentException("authenticated result requires a soul");
        }
    }

    static AuthResult authenticated(final Soul soul, @Nullable final Soul replaced) {
        return new AuthResult(Status.AUTHENTICATED, soul, replaced);
    }

    static AuthResult failed() {
        return new AuthResult(Status.AUTH_FAILED, null, null);
    }

    static AuthResult expired() {
        return new AuthResult(Status.CHALLENGE_EXPIRED, null, null);
    }

    public boolean isAuthenticated() {
        return status == Status.AUTHENTICATED;
    }
}
