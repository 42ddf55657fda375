// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a listing price is not a positive integer.
 *
 * @since 0.1.0
 */
public final class InvalidPriceException extends MarketException {

    public InvalidPriceException(final String price) {
        super(ReplyCode.ERR_INVALID_PRICE, "Invalid price: " + price);
    }
}
