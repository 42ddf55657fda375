// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.auth.AuthenticationStatus;
import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.error.AdmissionLimitException;
import sh.soulwire.core.error.InvalidSignatureException;
import sh.soulwire.core.error.MarketStateException;
import sh.soulwire.core.error.UnknownListingException;
import sh.soulwire.core.error.UnknownTradeException;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.reputation.ReputationLedger;
import sh.soulwire.core.reputation.SubmitResult;
import sh.soulwire.core.store.Journal;
import sh.soulwire.core.store.ListingRecord;
import sh.soulwire.core.store.MarketRecord;
import sh.soulwire.core.store.TradeRecord;

/**
 * Service marketplace: per-category order books, synchronous matching and the
 * two-party trade handshake.
 *
 * <h2>Matching</h2>
 * <p>
 * A new listing is matched against the opposite side of its category's book at
 * placement time. Resting listings are tried in {@link ListingPriority} order; the
 * first compatible one ({@code offer.price <= request.price}, different owners) wins.
 * Both listings move to MATCHED and a PROPOSED {@link Trade} is created at the
 * resting listing's price. There are no partial fills.
 *
 * <h2>Handshake</h2>
 * <p>
 * Each party accepts by signing the endorsement it issues for the counterparty
 * (see {@link TradeEndorsements}). When both signatures are recorded the trade
 * settles and both endorsements are submitted to the {@link ReputationLedger}.
 * Trades that miss their deadline are aborted by {@link #sweepExpired()} and their
 * listings end CANCELLED.
 *
 * <h2>Concurrency</h2>
 * <p>
 * Each category has its own lock, held for the whole of any listing or trade
 * transition in that category. Categories proceed in parallel. Listener callbacks
 * run after the lock is released.
 *
 * <h2>Persistence</h2>
 * <p>
 * Every transition is journaled before it becomes visible. On restart the latest
 * snapshot per id is restored; OPEN listings from the previous process are
 * cancelled because their sessions no longer exist, while trades keep their
 * deadlines.
 *
 * @since 0.1.0
 */
public final class Marketplace {

    private static final Logger log = LoggerFactory.getLogger(Marketplace.class);

    private static final Comparator<ServiceListing> BROWSE_ORDER = Comparator
            .comparing((ServiceListing listing) -> listing.category().value())
            .thenComparingLong(ServiceListing::sequence);

    private final ListingPriority priority;
    private final Journal<MarketRecord> journal;
    private final Clock clock;
    private final SoulSigner signer;
    private final ReputationLedger ledger;
    private final MarketListener listener;
    private final Duration listingTtl;
    private final Duration tradeDeadline;
    private final int maxOpenListings;
    private final long tradeCredit;

    private final Map<Category, OrderBook> books = new ConcurrentHashMap<>();
    private final Map<String, ServiceListing> listings = new ConcurrentHashMap<>();
    private final Map<String, Trade> trades = new ConcurrentHashMap<>();
    private final Map<SoulId, Integer> openCounts = new ConcurrentHashMap<>();
    private final AtomicLong listingCounter = new AtomicLong();
    private final AtomicLong tradeCounter = new AtomicLong();

    public Marketplace(
            final SoulwireConfig config,
            final ListingPriority priority,
            final Journal<MarketRecord> journal,
            final Clock clock,
            final SoulSigner signer,
            final ReputationLedger ledger,
            final MarketListener listener) {
        Objects.requireNonNull(config, "config");
        this.priority = Objects.requireNonNull(priority, "priority");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.listingTtl = config.listingTtl();
        this.tradeDeadline = config.tradeDeadline();
        this.maxOpenListings = config.maxOpenListings();
        this.tradeCredit = config.tradeCredit();
        restore();
    }

    /**
     * Places a listing and matches it synchronously.
     *
     * @return the listing as it stands after matching (OPEN or MATCHED)
     * @throws AdmissionLimitException if {@code owner} already has the maximum number of OPEN listings
     */
    public ServiceListing list(
            final SoulId owner,
            final String sessionId,
            final Side side,
            final Category category,
            final Price price) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(price, "price");

        reserveSlot(owner);
        final OrderBook book = bookFor(category);
        final List<Runnable> notifications = new ArrayList<>(1);
        ServiceListing result;
        book.lock.lock();
        try {
            final Instant now = clock.instant();
            final ServiceListing listing = new ServiceListing(
                    "L" + listingCounter.incrementAndGet(),
                    side,
                    category,
                    price,
                    owner,
                    sessionId,
                    book.nextSequence(),
                    now,
                    now.plus(listingTtl),
                    ListingStatus.OPEN);
            try {
                journal.append(MarketRecords.toRecord(listing));
            } catch (RuntimeException e) {
                releaseSlot(owner);
                throw e;
            }
            listings.put(listing.listingId(), listing);
            log.debug("Listed {} {} {} at {} for {} (seq {})", listing.listingId(), side, category, price, owner,
                    listing.sequence());

            final Optional<ServiceListing> counterpart =
                    book.bestMatch(listing, priority.restingOrder(side.opposite()), now);
            if (counterpart.isEmpty()) {
                book.rest(listing);
                result = listing;
            } else {
                final Trade trade;
                try {
                    trade = match(book, listing, counterpart.get(), now);
                } catch (RuntimeException e) {
                    book.rest(listing);
                    throw e;
                }
                notifications.add(() -> listener.onTradeProposed(trade));
                result = listings.get(listing.listingId());
            }
        } finally {
            book.lock.unlock();
        }
        fire(notifications);
        return result;
    }

    private Trade match(
            final OrderBook book,
            final ServiceListing incoming,
            final ServiceListing resting,
            final Instant now) {
        final ServiceListing offer = incoming.side() == Side.OFFER ? incoming : resting;
        final ServiceListing request = incoming.side() == Side.OFFER ? resting : incoming;
        final Trade trade = new Trade(
                "T" + tradeCounter.incrementAndGet(),
                offer.listingId(),
                request.listingId(),
                book.category,
                resting.price(),
                offer.owner(),
                request.owner(),
                TradeStatus.PROPOSED,
                now,
                now.plus(tradeDeadline),
                null,
                null);
        final ServiceListing matchedIncoming = incoming.withStatus(ListingStatus.MATCHED);
        final ServiceListing matchedResting = resting.withStatus(ListingStatus.MATCHED);

        // Trade first: on replay a trade whose listings still read OPEN is recoverable.
        journal.append(MarketRecords.toRecord(trade));
        journal.append(MarketRecords.toRecord(matchedResting));
        journal.append(MarketRecords.toRecord(matchedIncoming));

        book.remove(resting);
        listings.put(matchedResting.listingId(), matchedResting);
        listings.put(matchedIncoming.listingId(), matchedIncoming);
        trades.put(trade.tradeId(), trade);
        releaseSlot(incoming.owner());
        releaseSlot(resting.owner());
        log.info("Matched {} with {} in {} at {}: trade {} ({} provides, {} seeks)", offer.listingId(),
                request.listingId(), book.category, trade.price(), trade.tradeId(), trade.provider(), trade.seeker());
        return trade;
    }

    /**
     * Withdraws an OPEN listing.
     *
     * @throws UnknownListingException if the listing does not exist
     * @throws MarketStateException    if {@code owner} does not own it or it is no longer OPEN
     */
    public ServiceListing cancel(final SoulId owner, final String listingId) {
        final ServiceListing known = listings.get(listingId);
        if (known == null) {
            throw new UnknownListingException(listingId);
        }
        final OrderBook book = bookFor(known.category());
        final ServiceListing cancelled;
        book.lock.lock();
        try {
            final ServiceListing current = listings.get(listingId);
            if (!current.owner().equals(owner)) {
                throw new MarketStateException("Listing " + listingId + " is not owned by " + owner);
            }
            if (!current.isOpen()) {
                throw new MarketStateException("Listing " + listingId + " is " + current.status());
            }
            cancelled = close(book, current, ListingStatus.CANCELLED);
        } finally {
            book.lock.unlock();
        }
        log.info("Cancelled listing {} by {}", listingId, owner);
        fire(List.of(() -> listener.onListingClosed(cancelled)));
        return cancelled;
    }

    /**
     * Cancels every OPEN listing placed by a session that has disconnected. Trades
     * are left alone and abort at their deadline if not accepted.
     *
     * @return number of listings cancelled
     */
    public int sessionClosed(final String sessionId) {
        final Map<Category, List<String>> owned = new HashMap<>();
        for (ServiceListing listing : listings.values()) {
            if (listing.isOpen() && listing.sessionId().equals(sessionId)) {
                owned.computeIfAbsent(listing.category(), c -> new ArrayList<>()).add(listing.listingId());
            }
        }
        final List<Runnable> notifications = new ArrayList<>();
        for (Map.Entry<Category, List<String>> entry : owned.entrySet()) {
            final OrderBook book = bookFor(entry.getKey());
            book.lock.lock();
            try {
                for (String listingId : entry.getValue()) {
                    final ServiceListing current = listings.get(listingId);
                    if (current.isOpen()) {
                        final ServiceListing cancelled = close(book, current, ListingStatus.CANCELLED);
                        notifications.add(() -> listener.onListingClosed(cancelled));
                    }
                }
            } finally {
                book.lock.unlock();
            }
        }
        if (!notifications.isEmpty()) {
            log.info("Cancelled {} open listings of closed session {}", notifications.size(), sessionId);
        }
        fire(notifications);
        return notifications.size();
    }

    /**
     * Records {@code party}'s acceptance of a trade.
     *
     * <p>
     * {@code endorsement} must be the party's signature over
     * {@link TradeEndorsements#payload(Trade, Role, long)} for its role. Accepting
     * twice is a no-op. The acceptance that completes the handshake settles the trade
     * and submits both endorsements to the ledger.
     *
     * @return the trade after the acceptance
     * @throws UnknownTradeException     if the trade does not exist
     * @throws MarketStateException      if {@code party} is not a party, the trade is
     *                                   final, or its deadline has passed
     * @throws InvalidSignatureException if the endorsement does not verify; nothing is recorded
     */
    public Trade accept(final SoulId party, final String tradeId, final Signature endorsement) {
        Objects.requireNonNull(party, "party");
        Objects.requireNonNull(endorsement, "endorsement");
        final Trade known = trades.get(tradeId);
        if (known == null) {
            throw new UnknownTradeException(tradeId);
        }
        final OrderBook book = bookFor(known.category());
        final Trade updated;
        book.lock.lock();
        try {
            final Trade current = trades.get(tradeId);
            if (current.status().isTerminal()) {
                throw new MarketStateException("Trade " + tradeId + " is " + current.status());
            }
            final Role role = current.roleOf(party)
                    .orElseThrow(() -> new MarketStateException(party + " is not a party to trade " + tradeId));
            if (current.hasAccepted(role)) {
                return current;
            }
            if (current.isExpired(clock.instant())) {
                throw new MarketStateException("Trade " + tradeId + " is past its deadline");
            }
            final String payload = TradeEndorsements.payload(current, role, tradeCredit);
            if (!signer.verify(party, payload, endorsement)) {
                throw new InvalidSignatureException("Acceptance signature for " + tradeId + " does not verify");
            }
            updated = current.withAcceptance(role, endorsement);
            journal.append(MarketRecords.toRecord(updated));
            trades.put(tradeId, updated);
        } finally {
            book.lock.unlock();
        }
        log.info("Trade {} accepted by {} -> {}", tradeId, party, updated.status());
        if (updated.status() == TradeStatus.SETTLED) {
            try {
                settle(updated);
            } finally {
                fire(List.of(() -> listener.onTradeSettled(updated)));
            }
        }
        return updated;
    }

    private void settle(final Trade trade) {
        // Both acceptances were recorded from authenticated sessions of exactly these two souls.
        final AuthenticationStatus parties = soul -> soul.equals(trade.provider()) || soul.equals(trade.seeker());
        for (Role endorser : Role.values()) {
            final SubmitResult result = ledger.submitSettlement(
                    TradeEndorsements.event(trade, endorser, tradeCredit, trade.signatureOf(endorser)), parties);
            if (result == SubmitResult.REJECTED) {
                log.warn("Settlement endorsement by {} for trade {} was rejected", trade.party(endorser),
                        trade.tradeId());
            }
        }
    }

    /**
     * Expires OPEN listings past their TTL and aborts unfinished trades past their
     * deadline. Listings of an aborted trade end CANCELLED.
     *
     * @return number of listings expired plus trades aborted
     */
    public int sweepExpired() {
        final Instant now = clock.instant();
        final List<Runnable> notifications = new ArrayList<>();
        int swept = 0;

        for (OrderBook book : books.values()) {
            book.lock.lock();
            try {
                for (ServiceListing listing : book.expired(now)) {
                    final ServiceListing expired = close(book, listing, ListingStatus.EXPIRED);
                    notifications.add(() -> listener.onListingClosed(expired));
                    swept++;
                }
            } finally {
                book.lock.unlock();
            }
        }

        for (Trade candidate : trades.values()) {
            if (candidate.status().isTerminal() || !candidate.isExpired(now)) {
                continue;
            }
            final OrderBook book = bookFor(candidate.category());
            book.lock.lock();
            try {
                final Trade current = trades.get(candidate.tradeId());
                if (current.status().isTerminal()) {
                    continue;
                }
                final Trade aborted = abort(current);
                notifications.add(() -> listener.onTradeAborted(aborted));
                swept++;
            } finally {
                book.lock.unlock();
            }
        }

        if (swept > 0) {
            log.debug("Market sweep closed {} listings/trades", swept);
        }
        fire(notifications);
        return swept;
    }

    private Trade abort(final Trade trade) {
        final Trade aborted = trade.aborted();
        journal.append(MarketRecords.toRecord(aborted));
        trades.put(aborted.tradeId(), aborted);
        cancelMatched(trade.offerId());
        cancelMatched(trade.requestId());
        log.info("Trade {} aborted at deadline ({})", trade.tradeId(), trade.status());
        return aborted;
    }

    private void cancelMatched(final String listingId) {
        final ServiceListing listing = listings.get(listingId);
        if (listing == null || listing.status() != ListingStatus.MATCHED) {
            return;
        }
        final ServiceListing cancelled = listing.withStatus(ListingStatus.CANCELLED);
        journal.append(MarketRecords.toRecord(cancelled));
        listings.put(listingId, cancelled);
    }

    private ServiceListing close(final OrderBook book, final ServiceListing listing, final ListingStatus status) {
        final ServiceListing closed = listing.withStatus(status);
        journal.append(MarketRecords.toRecord(closed));
        book.remove(listing);
        listings.put(closed.listingId(), closed);
        releaseSlot(listing.owner());
        return closed;
    }

    /**
     * Returns the OPEN listings, by category then sequence.
     */
    public List<ServiceListing> openListings() {
        final List<ServiceListing> result = new ArrayList<>();
        for (ServiceListing listing : listings.values()) {
            if (listing.isOpen()) {
                result.add(listing);
            }
        }
        result.sort(BROWSE_ORDER);
        return result;
    }

    public Optional<ServiceListing> listing(final String listingId) {
        return Optional.ofNullable(listings.get(listingId));
    }

    public Optional<Trade> trade(final String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    /**
     * Returns the number of OPEN listings {@code owner} holds.
     */
    public int openListingCount(final SoulId owner) {
        return openCounts.getOrDefault(owner, 0);
    }

    private OrderBook bookFor(final Category category) {
        return books.computeIfAbsent(category, OrderBook::new);
    }

    private void reserveSlot(final SoulId owner) {
        openCounts.compute(owner, (soul, count) -> {
            final int current = count == null ? 0 : count;
            if (current >= maxOpenListings) {
                throw new AdmissionLimitException(soul.value(), maxOpenListings);
            }
            return current + 1;
        });
    }

    private void releaseSlot(final SoulId owner) {
        openCounts.computeIfPresent(owner, (soul, count) -> count <= 1 ? null : count - 1);
    }

    private void fire(final List<Runnable> notifications) {
        for (Runnable notification : notifications) {
            try {
                notification.run();
            } catch (RuntimeException e) {
                log.warn("Market listener failed", e);
            }
        }
    }

    private void restore() {
        final Map<String, ServiceListing> restoredListings = new HashMap<>();
        final Map<String, Trade> restoredTrades = new HashMap<>();
        journal.replay(record -> {
            if (record instanceof ListingRecord listingRecord) {
                restoredListings.put(listingRecord.listingId(), MarketRecords.fromRecord(listingRecord));
            } else if (record instanceof TradeRecord tradeRecord) {
                restoredTrades.put(tradeRecord.tradeId(), MarketRecords.fromRecord(tradeRecord));
            }
        });

        trades.putAll(restoredTrades);
        final Set<String> tradedListings = new HashSet<>();
        for (Trade trade : restoredTrades.values()) {
            tradedListings.add(trade.offerId());
            tradedListings.add(trade.requestId());
            tradeCounter.accumulateAndGet(MarketRecords.counterOf(trade.tradeId()), Math::max);
        }
        int cancelled = 0;
        for (ServiceListing listing : restoredListings.values()) {
            bookFor(listing.category()).observeSequence(listing.sequence());
            listingCounter.accumulateAndGet(MarketRecords.counterOf(listing.listingId()), Math::max);
            ServiceListing current = listing;
            if (listing.isOpen() || (listing.status() == ListingStatus.MATCHED
                    && !tradedListings.contains(listing.listingId()))) {
                current = listing.withStatus(ListingStatus.CANCELLED);
                journal.append(MarketRecords.toRecord(current));
                cancelled++;
            }
            listings.put(current.listingId(), current);
        }
        log.info("Market restored {} listings and {} trades; cancelled {} listings of the previous process",
                listings.size(), trades.size(), cancelled);
    }
}
