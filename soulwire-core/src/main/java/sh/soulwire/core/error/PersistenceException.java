// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a journal cannot be read or appended.
 * <p>
 * A failed append leaves in-memory state unchanged, so the rejected mutation can be
 * retried once storage recovers.
 *
 * @since 0.1.0
 */
public final class PersistenceException extends SoulwireException {

    public PersistenceException(final String message, final Throwable cause) {
        super(ReplyCode.ERR_INTERNAL, message, cause);
    }

    public PersistenceException(final String message) {
        super(ReplyCode.ERR_INTERNAL, message);
    }
}
