// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Base class for marketplace failures: actions on listings or trades in the wrong
 * state, unknown ids, bad prices, admission limits and invalid acceptance signatures.
 * <p>
 * A rejected market action never mutates the order book.
 *
 * @since 0.1.0
 */
public non-sealed class MarketException extends SoulwireException {

    public MarketException(final ReplyCode replyCode, final String message) {
        super(replyCode, message);
    }
}
