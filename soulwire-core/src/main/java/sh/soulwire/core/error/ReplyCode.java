// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Reply codes surfaced to a session when a command cannot be honoured.
 *
 * <p>Every externally triggerable failure maps to one of these codes; none of them
 * closes the connection.
 *
 * @since 0.1.0
 */
public enum ReplyCode {
    ERR_UNKNOWN_SOUL,
    ERR_AUTH_FAILED,
    ERR_CHALLENGE_EXPIRED,
    ERR_NOT_AUTHENTICATED,
    ERR_DUPLICATE_SOUL,
    ERR_REGISTRATION_CLOSED,
    ERR_NO_KEY,
    ERR_INVALID_PRICE,
    ERR_INVALID_SIGNATURE,
    ERR_UNKNOWN_LISTING,
    ERR_UNKNOWN_TRADE,
    ERR_INVALID_STATE,
    ERR_LIMIT,
    ERR_REJECTED,
    ERR_SYNTAX,
    ERR_UNKNOWN_COMMAND,
    ERR_LINE_TOO_LONG,
    ERR_INTERNAL;

    /**
     * Formats the reply line for this code.
     *
     * @param detail optional human-readable detail, may be null
     * @return the reply line, e.g. {@code ERR_SYNTAX missing category}
     */
    public String format(final String detail) {
        if (detail == null || detail.isBlank()) {
            return name();
        }
        return name() + " " + detail.replace('\r', ' ').replace('\n', ' ');
    }
}
