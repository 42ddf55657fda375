// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when an action targets a listing or trade whose state does not allow it,
 * for example cancelling a MATCHED listing or accepting a settled trade.
 *
 * @since 0.1.0
 */
public final class MarketStateException extends MarketException {

    public MarketStateException(final String message) {
        super(ReplyCode.ERR_INVALID_STATE, message);
    }
}
