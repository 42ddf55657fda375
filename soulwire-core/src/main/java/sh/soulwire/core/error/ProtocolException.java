// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a command line is malformed. The connection stays open.
 *
 * @since 0.1.0
 */
public final class ProtocolException extends SoulwireException {

    public ProtocolException(final String message) {
        super(ReplyCode.ERR_SYNTAX, message);
    }

    public ProtocolException(final ReplyCode replyCode, final String message) {
        super(replyCode, message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(ReplyCode.ERR_SYNTAX, message, cause);
    }
}
