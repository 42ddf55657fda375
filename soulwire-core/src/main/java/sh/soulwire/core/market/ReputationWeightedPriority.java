// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.util.Comparator;
import java.util.Objects;

import sh.soulwire.core.reputation.ReputationLedger;

/**
 * Reputation first: the owner with the higher score wins, ties fall back to
 * price-time priority.
 *
 * @since 0.1.0
 */
public final class ReputationWeightedPriority implements ListingPriority {

    private final Comparator<ServiceListing> order;

    public ReputationWeightedPriority(final ReputationLedger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        this.order = Comparator
                .comparingLong((ServiceListing listing) -> ledger.scoreOf(listing.owner()))
                .reversed()
                .thenComparing(PriceTimePriority.ORDER);
    }

    @Override
    public Comparator<ServiceListing> restingOrder(final Side restingSide) {
        return order;
    }

    @Override
    public String toString() {
        return "ReputationWeightedPriority";
    }
}
