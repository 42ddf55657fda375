// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a trade id does not exist.
 *
 * @since 0.1.0
 */
public final class UnknownTradeException extends MarketException {

    public UnknownTradeException(final String tradeId) {
        super(ReplyCode.ERR_UNKNOWN_TRADE, "Unknown trade: " + tradeId);
    }
}
