// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.time.Instant;
import java.util.Objects;

import sh.soulwire.core.error.MarketStateException;
import sh.soulwire.core.identity.SoulId;

/**
 * An offer or request in a category's order book. Immutable; every transition
 * produces a new snapshot through {@link #withStatus(ListingStatus)}.
 *
 * @param listingId unique listing id
 * @param side      OFFER or REQUEST
 * @param category  order book the listing belongs to
 * @param price     asking price (offer) or maximum price (request)
 * @param owner     owning soul
 * @param sessionId session that placed the listing
 * @param sequence  arrival order within the category, strictly increasing
 * @param createdAt placement time
 * @param expiresAt time after which an unmatched listing expires
 * @param status    lifecycle state
 * @since 0.1.0
 */
public record ServiceListing(
        String listingId,
        Side side,
        Category category,
        Price price,
        SoulId owner,
        String sessionId,
        long sequence,
        Instant createdAt,
        Instant expiresAt,
        ListingStatus status) {

    public ServiceListing {
        Objects.requireNonNull(listingId, "listingId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Returns this listing in {@code next} state.
     *
     * @throws MarketStateException if the lifecycle does not allow the transition
     */
    public ServiceListing withStatus(final ListingStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new MarketStateException("Listing " + listingId + " cannot move from " + status + " to " + next);
        }
        return new ServiceListing(listingId, side, category, price, owner, sessionId, sequence, createdAt, expiresAt,
                next);
    }

    public boolean isOpen() {
        return status == ListingStatus.OPEN;
    }

    public boolean isExpired(final Instant now) {
        return !now.isBefore(expiresAt);
    }
}
