// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

import java.util.Objects;

/**
 * Base runtime exception for all Soulwire failures.
 *
 * <p>
 * The sealed hierarchy lets the command dispatcher translate any failure into a
 * {@link ReplyCode} with a single catch clause.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SoulwireException
 * ├── {@link IdentityException} - unknown souls, duplicate registration, missing auth or keys
 * ├── {@link MarketException} - listing and trade state violations, admission limits
 * ├── {@link ProtocolException} - malformed command lines
 * └── {@link PersistenceException} - journal I/O failures
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class SoulwireException extends RuntimeException
        permits IdentityException,
        MarketException,
        ProtocolException,
        PersistenceException {

    private final ReplyCode replyCode;

    public SoulwireException(final ReplyCode replyCode, final String message) {
        super(message);
        this.replyCode = Objects.requireNonNull(replyCode, "replyCode");
    }

    public SoulwireException(final ReplyCode replyCode, final String message, final Throwable cause) {
        super(message, cause);
        this.replyCode = Objects.requireNonNull(replyCode, "replyCode");
    }

    /**
     * Returns the code reported to the offending session.
     */
    public ReplyCode replyCode() {
        return replyCode;
    }
}
