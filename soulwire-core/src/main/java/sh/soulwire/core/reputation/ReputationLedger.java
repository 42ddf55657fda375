// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.reputation;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.auth.AuthenticationStatus;
import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.error.PersistenceException;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.store.Journal;
import sh.soulwire.core.store.ReputationRecord;

/**
 * Append-only reputation ledger.
 *
 * <p>
 * Admission, in order:
 * <ol>
 * <li>an id in the settlement namespace is {@link SubmitResult#REJECTED} unless it
 * arrives through {@link #submitSettlement}</li>
 * <li>an event id that was already accepted is a {@link SubmitResult#DUPLICATE}</li>
 * <li>self-endorsement, {@code |delta|} above the configured maximum, a signature
 * that does not verify against the endorser's key (including unknown endorsers) or
 * an endorser without an authenticated session is {@link SubmitResult#REJECTED}</li>
 * <li>otherwise the event is journaled, then folded into the subject's score</li>
 * </ol>
 *
 * <p>
 * The id is claimed atomically before the journal append, so concurrent submissions
 * of one id apply it exactly once. Per-subject updates run inside
 * {@link ConcurrentHashMap#compute}; different subjects never contend.
 * {@link #scoreOf(SoulId)} is O(1).
 *
 * @since 0.1.0
 */
public final class ReputationLedger {

    private static final Logger log = LoggerFactory.getLogger(ReputationLedger.class);

    private final Journal<ReputationRecord> journal;
    private final SoulSigner signer;
    private final AuthenticationStatus authentication;
    private final long maxDelta;
    private final Clock clock;
    private final Set<String> seenIds = ConcurrentHashMap.newKeySet();
    private final Map<SoulId, Account> accounts = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger();

    public ReputationLedger(
            final Journal<ReputationRecord> journal,
            final SoulSigner signer,
            final AuthenticationStatus authentication,
            final long maxDelta,
            final Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.authentication = Objects.requireNonNull(authentication, "authentication");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxDelta <= 0) {
            throw new IllegalArgumentException("maxDelta must be positive, got " + maxDelta);
        }
        this.maxDelta = maxDelta;
        journal.replay(this::restore);
        log.info("Reputation ledger loaded with {} events for {} souls", size.get(), accounts.size());
    }

    /**
     * Submits an event, checking the endorser against the node's live sessions.
     */
    public SubmitResult submit(final ReputationEvent event) {
        return submit(event, authentication);
    }

    /**
     * Submits an event, checking the endorser against {@code status}.
     *
     * @throws PersistenceException if the journal append fails; the event id stays unclaimed
     */
    public SubmitResult submit(final ReputationEvent event, final AuthenticationStatus status) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(status, "status");
        if (event.isSettlement()) {
            log.info("Rejected reputation event {} from {}: reserved settlement id", event.eventId(),
                    event.endorser());
            return SubmitResult.REJECTED;
        }
        return admit(event, status);
    }

    /**
     * Submits a trade settlement event. {@code parties} is the marketplace's view of
     * which souls accepted the trade from an authenticated session.
     *
     * @throws IllegalArgumentException if the id is outside the settlement namespace
     * @throws PersistenceException     if the journal append fails
     */
    public SubmitResult submitSettlement(final ReputationEvent event, final AuthenticationStatus parties) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(parties, "parties");
        if (!event.isSettlement()) {
            throw new IllegalArgumentException("Not a settlement event id: " + event.eventId());
        }
        return admit(event, parties);
    }

    private SubmitResult admit(final ReputationEvent event, final AuthenticationStatus status) {
        if (seenIds.contains(event.eventId())) {
            log.debug("Duplicate reputation event {}", event.eventId());
            return SubmitResult.DUPLICATE;
        }
        final String rejection = admissionFailure(event, status);
        if (rejection != null) {
            log.info("Rejected reputation event {} from {}: {}", event.eventId(), event.endorser(), rejection);
            return SubmitResult.REJECTED;
        }
        if (!seenIds.add(event.eventId())) {
            return SubmitResult.DUPLICATE;
        }

        final LedgerEntry entry = new LedgerEntry(event, clock.instant());
        try {
            accounts.compute(event.subject(), (subject, account) -> {
                final Account target = account != null ? account : new Account();
                journal.append(toRecord(entry));
                target.add(entry);
                return target;
            });
        } catch (PersistenceException e) {
            seenIds.remove(event.eventId());
            throw e;
        }
        size.incrementAndGet();
        log.debug("Accepted reputation event {}: {} {} for {}", event.eventId(), event.reason(), event.delta(),
                event.subject());
        return SubmitResult.ACCEPTED;
    }

    private String admissionFailure(final ReputationEvent event, final AuthenticationStatus status) {
        if (event.endorser().equals(event.subject())) {
            return "self-endorsement";
        }
        if (event.delta() == Long.MIN_VALUE || Math.abs(event.delta()) > maxDelta) {
            return "delta " + event.delta() + " exceeds " + maxDelta;
        }
        if (!signer.verify(event.endorser(), event.canonicalPayload(), event.signature())) {
            return "signature does not verify";
        }
        if (!status.isAuthenticated(event.endorser())) {
            return "endorser not authenticated";
        }
        return null;
    }

    /**
     * Returns the sum of accepted deltas for {@code soul}; 0 if none.
     */
    public long scoreOf(final SoulId soul) {
        final Account account = accounts.get(soul);
        return account == null ? 0 : account.score;
    }

    /**
     * Returns the events applied to {@code soul}, in admission order.
     */
    public List<LedgerEntry> eventsFor(final SoulId soul) {
        final Account account = accounts.get(soul);
        return account == null ? List.of() : account.snapshot();
    }

    public boolean contains(final String eventId) {
        return seenIds.contains(eventId);
    }

    /**
     * Returns the number of accepted events.
     */
    public int size() {
        return size.get();
    }

    private void restore(final ReputationRecord record) {
        if (!seenIds.add(record.eventId())) {
            log.warn("Ignoring duplicate journal entry for event {}", record.eventId());
            return;
        }
        final ReputationEvent event = new ReputationEvent(
                record.eventId(),
                SoulId.of(record.subject()),
                record.delta(),
                record.reason(),
                SoulId.of(record.endorser()),
                Signature.fromHex(record.signature()));
        accounts.computeIfAbsent(event.subject(), subject -> new Account())
                .add(new LedgerEntry(event, Instant.ofEpochMilli(record.admittedAtMillis())));
        size.incrementAndGet();
    }

    private static ReputationRecord toRecord(final LedgerEntry entry) {
        final ReputationEvent event = entry.event();
        return new ReputationRecord(
                event.eventId(),
                event.subject().value(),
                event.delta(),
                event.reason(),
                event.endorser().value(),
                event.signature().toHex(),
                entry.admittedAt().toEpochMilli());
    }

    private static final class Account {
        private final List<LedgerEntry> entries = new ArrayList<>();
        private volatile long score;

        synchronized void add(final LedgerEntry entry) {
            entries.add(entry);
            score += entry.event().delta();
        }

        synchronized List<LedgerEntry> snapshot() {
            return List.copyOf(entries);
        }
    }
}
