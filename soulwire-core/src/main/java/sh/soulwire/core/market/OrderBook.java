// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resting OPEN listings of one category.
 *
 * <p>
 * Not thread-safe on its own: every method must be called with {@link #lock} held.
 * The marketplace holds it for the whole of a placement, cancellation or trade
 * transition, which serializes matching within the category.
 */
final class OrderBook {

    final Category category;
    final ReentrantLock lock = new ReentrantLock();

    private final List<ServiceListing> offers = new ArrayList<>();
    private final List<ServiceListing> requests = new ArrayList<>();
    private long lastSequence;

    OrderBook(final Category category) {
        this.category = category;
    }

    long nextSequence() {
        return ++lastSequence;
    }

    void observeSequence(final long sequence) {
        lastSequence = Math.max(lastSequence, sequence);
    }

    void rest(final ServiceListing listing) {
        side(listing.side()).add(listing);
    }

    boolean remove(final ServiceListing listing) {
        final List<ServiceListing> resting = side(listing.side());
        for (int i = 0; i < resting.size(); i++) {
            if (resting.get(i).listingId().equals(listing.listingId())) {
                resting.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the best compatible resting counterpart for {@code incoming}.
     * Compatible means opposite side, different owner, {@code offer.price <= request.price}
     * and not past its expiry.
     */
    Optional<ServiceListing> bestMatch(
            final ServiceListing incoming,
            final Comparator<ServiceListing> order,
            final Instant now) {
        ServiceListing best = null;
        for (ServiceListing candidate : side(incoming.side().opposite())) {
            if (!compatible(incoming, candidate, now)) {
                continue;
            }
            if (best == null || order.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the resting listings past their expiry.
     */
    List<ServiceListing> expired(final Instant now) {
        final List<ServiceListing> result = new ArrayList<>();
        for (ServiceListing listing : offers) {
            if (listing.isExpired(now)) {
                result.add(listing);
            }
        }
        for (ServiceListing listing : requests) {
            if (listing.isExpired(now)) {
                result.add(listing);
            }
        }
        return result;
    }

    int size() {
        return offers.size() + requests.size();
    }

    private static boolean compatible(final ServiceListing incoming, final ServiceListing candidate, final Instant now) {
        if (candidate.owner().equals(incoming.owner()) || candidate.isExpired(now)) {
            return false;
        }
        final ServiceListing offer = incoming.side() == Side.OFFER ? incoming : candidate;
        final ServiceListing request = incoming.side() == Side.OFFER ? candidate : incoming;
        return offer.price().units() <= request.price().units();
    }

    private List<ServiceListing> side(final Side side) {
        return side == Side.OFFER ? offers : requests;
    }
}
