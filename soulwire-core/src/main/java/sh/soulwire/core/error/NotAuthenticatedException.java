// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a command that requires a bound soul arrives from an anonymous session.
 *
 * @since 0.1.0
 */
public final class NotAuthenticatedException extends IdentityException {

    public NotAuthenticatedException(final String command) {
        super(ReplyCode.ERR_NOT_AUTHENTICATED, command + " requires an authenticated soul");
    }
}
