// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a session tries to self-register a soul while open registration is disabled.
 *
 * @since 0.1.0
 */
public final class RegistrationClosedException extends IdentityException {

    public RegistrationClosedException() {
        super(ReplyCode.ERR_REGISTRATION_CLOSED, "Open registration is disabled");
    }
}
