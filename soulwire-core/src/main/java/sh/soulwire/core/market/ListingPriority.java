// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.util.Comparator;

/**
 * Orders resting listings when an incoming listing looks for a counterpart.
 *
 * <p>
 * The first compatible listing in this order wins the match. Implementations may
 * consult live state (such as reputation), so the order is evaluated at match time
 * rather than cached in a sorted structure. Orders must be total; ending with the
 * listing sequence guarantees that, since sequences are unique per category.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ListingPriority {

    /**
     * Returns the order in which listings resting on {@code restingSide} are tried,
     * best first.
     */
    Comparator<ServiceListing> restingOrder(Side restingSide);
}
