// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a listing id does not exist.
 *
 * @since 0.1.0
 */
public final class UnknownListingException extends MarketException {

    public UnknownListingException(final String listingId) {
        super(ReplyCode.ERR_UNKNOWN_LISTING, "Unknown listing: " + listingId);
    }
}
