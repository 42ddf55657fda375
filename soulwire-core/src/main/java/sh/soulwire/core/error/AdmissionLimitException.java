// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a soul already owns the maximum number of OPEN listings.
 *
 * @since 0.1.0
 */
public final class AdmissionLimitException extends MarketException {

    public AdmissionLimitException(final String soulId, final int limit) {
        super(ReplyCode.ERR_LIMIT, "Soul " + soulId + " already has " + limit + " open listings");
    }
}
