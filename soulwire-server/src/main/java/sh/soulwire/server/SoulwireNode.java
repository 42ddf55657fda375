// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.auth.SoulAuthenticator;
import sh.soulwire.core.crypto.InMemoryKeyCustody;
import sh.soulwire.core.crypto.KeyCustody;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.identity.IdentityRegistry;
import sh.soulwire.core.market.ListingPriority;
import sh.soulwire.core.market.Marketplace;
import sh.soulwire.core.market.PriceTimePriority;
import sh.soulwire.core.market.ReputationWeightedPriority;
import sh.soulwire.core.reputation.ReputationLedger;
import sh.soulwire.core.store.JsonLinesJournal;
import sh.soulwire.core.store.MarketRecord;
import sh.soulwire.core.store.ReputationRecord;
import sh.soulwire.core.store.SoulRecord;

/**
 * One running Soulwire process: journals, core components, the line server and
 * the expiry sweeper, wired from a {@link SoulwireConfig}.
 *
 * <pre>{@code
 * try (SoulwireNode node = SoulwireNode.create(config, Clock.systemUTC())) {
 *     int port = node.start();
 *     node.awaitClose();
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class SoulwireNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SoulwireNode.class);

    static final String SOULS_JOURNAL = "souls.jsonl";
    static final String REPUTATION_JOURNAL = "reputation.jsonl";
    static final String MARKET_JOURNAL = "market.jsonl";

    private final List<AutoCloseable> journals;
    private final IdentityRegistry registry;
    private final ReputationLedger ledger;
    private final Marketplace market;
    private final SoulwireServer server;
    private final ExpirySweeper sweeper;

    private SoulwireNode(
            final List<AutoCloseable> journals,
            final IdentityRegistry registry,
            final ReputationLedger ledger,
            final Marketplace market,
            final SoulwireServer server,
            final ExpirySweeper sweeper) {
        this.journals = journals;
        this.registry = registry;
        this.ledger = ledger;
        this.market = market;
        this.server = server;
        this.sweeper = sweeper;
    }

    /**
     * Creates a node whose key custody holds the keys under {@code config.keysDir()},
     * or no keys when that is unset.
     *
     * @throws IllegalArgumentException if a key file is invalid
     */
    public static SoulwireNode create(final SoulwireConfig config, final Clock clock) {
        Objects.requireNonNull(config, "config");
        final Path keysDir = config.keysDir();
        final InMemoryKeyCustody custody =
                keysDir == null ? new InMemoryKeyCustody() : InMemoryKeyCustody.fromDirectory(keysDir);
        if (custody.size() == 0) {
            log.info("No signing keys in custody; SIGN and unsigned SERVICE ACCEPT will reply ERR_NO_KEY");
        }
        return create(config, custody, clock);
    }

    /**
     * Opens the journals under {@code config.dataDir()} and builds every component.
     * Nothing listens until {@link #start()}.
     *
     * @param custody source of private keys for server-side signing
     */
    public static SoulwireNode create(final SoulwireConfig config, final KeyCustody custody, final Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(custody, "custody");
        Objects.requireNonNull(clock, "clock");
        final Path dir = config.dataDir();
        final List<AutoCloseable> journals = new ArrayList<>();
        try {
            final JsonLinesJournal<SoulRecord> souls =
                    JsonLinesJournal.open(dir.resolve(SOULS_JOURNAL), SoulRecord.class);
            journals.add(souls);
            final JsonLinesJournal<ReputationRecord> reputation =
                    JsonLinesJournal.open(dir.resolve(REPUTATION_JOURNAL), ReputationRecord.class);
            journals.add(reputation);
            final JsonLinesJournal<MarketRecord> marketJournal =
                    JsonLinesJournal.open(dir.resolve(MARKET_JOURNAL), MarketRecord.class);
            journals.add(marketJournal);

            final IdentityRegistry registry = new IdentityRegistry(souls);
            final SoulAuthenticator authenticator = new SoulAuthenticator(registry, clock, config.challengeTtl());
            final SoulSigner signer = new SoulSigner(registry, custody);
            final ReputationLedger ledger =
                    new ReputationLedger(reputation, signer, authenticator, config.maxReputationDelta(), clock);
            final SessionRegistry sessions = new SessionRegistry();
            final Marketplace market = new Marketplace(config, priority(config, ledger), marketJournal, clock, signer,
                    ledger, new MarketNotifier(sessions, config.tradeCredit()));
            final CommandDispatcher dispatcher = new CommandDispatcher(config, registry, authenticator, signer,
                    ledger, market, sessions, new BasicRelay(sessions, authenticator), clock);

            final SoulwireServer server = new SoulwireServer(config.host(), config.port(), config.ioThreads(),
                    config.maxLineLength(), dispatcher);
            final ExpirySweeper sweeper = new ExpirySweeper(authenticator, market, config.sweepInterval());
            log.info("Soulwire node created (data dir {}, priority {})", dir.toAbsolutePath(), config.priority());
            return new SoulwireNode(journals, registry, ledger, market, server, sweeper);
        } catch (RuntimeException e) {
            closeAll(journals);
            throw e;
        }
    }

    private static ListingPriority priority(final SoulwireConfig config, final ReputationLedger ledger) {
        return switch (config.priority()) {
            case PRICE_TIME -> new PriceTimePriority();
            case REPUTATION -> new ReputationWeightedPriority(ledger);
        };
    }

    /**
     * Starts the sweeper and binds the server.
     *
     * @return the bound port
     * @throws InterruptedException if interrupted while binding
     */
    public int start() throws InterruptedException {
        final int port = server.start();
        sweeper.start();
        return port;
    }

    public void awaitClose() throws InterruptedException {
        server.awaitClose();
    }

    public IdentityRegistry registry() {
        return registry;
    }

    public ReputationLedger ledger() {
        return ledger;
    }

    public Marketplace market() {
        return market;
    }

    @Override
    public void close() {
        server.close();
        sweeper.close();
        closeAll(journals);
        log.info("Soulwire node closed");
    }

    private static void closeAll(final List<AutoCloseable> journals) {
        for (AutoCloseable journal : journals) {
            try {
                journal.close();
            } catch (Exception e) {
                log.warn("Failed to close journal {}", journal, e);
            }
        }
    }
}
