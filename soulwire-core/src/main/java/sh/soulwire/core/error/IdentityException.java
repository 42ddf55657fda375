// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Base class for identity failures: unknown or duplicate souls, unauthenticated
 * sessions and unavailable signing keys.
 * <p>
 * Identity failures are always recoverable by the session that caused them.
 *
 * @since 0.1.0
 */
public non-sealed class IdentityException extends SoulwireException {

    public IdentityException(final ReplyCode replyCode, final String message) {
        super(replyCode, message);
    }

    public IdentityException(final ReplyCode replyCode, final String message, final Throwable cause) {
        super(replyCode, message, cause);
    }
}
