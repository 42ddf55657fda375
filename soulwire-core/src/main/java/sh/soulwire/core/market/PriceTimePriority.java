// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.util.Comparator;

/**
 * Price-time priority: the lowest price (best for the seeker), then the earliest
 * sequence. Applied identically to resting offers and resting requests.
 *
 * @since 0.1.0
 */
public final class PriceTimePriority implements ListingPriority {

    static final Comparator<ServiceListing> ORDER = Comparator
            .comparingLong((ServiceListing listing) -> listing.price().units())
            .thenComparingLong(ServiceListing::sequence);

    @Override
    public Comparator<ServiceListing> restingOrder(final Side restingSide) {
        return ORDER;
    }

    @Override
    public String toString() {
        return "PriceTimePriority";
    }
}
