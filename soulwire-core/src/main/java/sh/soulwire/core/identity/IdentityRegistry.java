// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.identity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.crypto.SoulKey;
import sh.soulwire.core.error.DuplicateSoulException;
import sh.soulwire.core.error.UnknownSoulException;
import sh.soulwire.core.store.Journal;
import sh.soulwire.core.store.SoulRecord;

/**
 * Registry of souls and their public keys.
 *
 * <p>
 * Lookups are lock-free. Registration is serialized so the journal append happens
 * before a soul becomes visible: a failed append leaves the registry unchanged.
 * The registry replays its journal once on construction.
 *
 * @since 0.1.0
 */
public final class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    private final Map<SoulId, Soul> souls = new ConcurrentHashMap<>();
    private final Journal<SoulRecord> journal;
    private final ReentrantLock writeLock = new ReentrantLock();

    public IdentityRegistry(final Journal<SoulRecord> journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
        journal.replay(this::restore);
        log.info("Identity registry loaded with {} souls", souls.size());
    }

    /**
     * Registers a new soul.
     *
     * @return the registered soul
     * @throws DuplicateSoulException if the id is already registered
     * @throws sh.soulwire.core.error.PersistenceException if the journal append fails
     */
    public Soul register(final Soul soul) {
        Objects.requireNonNull(soul, "soul");
        writeLock.lock();
        try {
            if (souls.containsKey(soul.id())) {
                throw new DuplicateSoulException(soul.id().value());
            }
            journal.append(toRecord(soul));
            souls.put(soul.id(), soul);
        } finally {
            writeLock.unlock();
        }
        log.info("Registered soul {}", soul.id());
        return soul;
    }

    public Optional<Soul> find(final SoulId id) {
        return Optional.ofNullable(souls.get(id));
    }

    /**
     * Returns the soul or throws.
     *
     * @throws UnknownSoulException if the id is not registered
     */
    public Soul require(final SoulId id) {
        final Soul soul = souls.get(id);
        if (soul == null) {
            throw new UnknownSoulException(id.value());
        }
        return soul;
    }

    public boolean contains(final SoulId id) {
        return souls.containsKey(id);
    }

    public int size() {
        return souls.size();
    }

    /**
     * Returns every soul, ordered by registration time then id.
     */
    public List<Soul> all() {
        final List<Soul> result = new ArrayList<>(souls.values());
        result.sort(Comparator.comparing(Soul::createdAt).thenComparing(s -> s.id().value()));
        return result;
    }

    private void restore(final SoulRecord record) {
        final Soul soul = new Soul(
                SoulId.of(record.id()),
                SoulKey.fromHex(record.publicKey()),
                record.paradigm(),
                record.mode(),
                Instant.ofEpochMilli(record.createdAtMillis()));
        if (souls.putIfAbsent(soul.id(), soul) != null) {
            log.warn("Ignoring duplicate journal entry for soul {}", soul.id());
        }
    }

    private static SoulRecord toRecord(final Soul soul) {
        return new SoulRecord(
                soul.id().value(),
                soul.key().toHex(),
                soul.paradigm(),
                soul.mode(),
                soul.createdAt().toEpochMilli());
    }
}
