// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.auth.Session;
import sh.soulwire.core.auth.SoulAuthenticator;
import sh.soulwire.core.crypto.InMemoryKeyCustody;
import sh.soulwire.core.crypto.PrivateKey;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.identity.IdentityRegistry;
import sh.soulwire.core.market.Marketplace;
import sh.soulwire.core.market.PriceTimePriority;
import sh.soulwire.core.reputation.ReputationLedger;
import sh.soulwire.core.store.InMemoryJournal;

/**
 * In-memory node for dispatcher-level tests, plus client helpers that speak the wire syntax.
 */
final class TestNode {

    final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    final IdentityRegistry registry = new IdentityRegistry(new InMemoryJournal<>());
    final InMemoryKeyCustody custody = new InMemoryKeyCustody();
    final SoulSigner signer = new SoulSigner(registry, custody);
    final SessionRegistry sessions = new SessionRegistry();
    final SoulAuthenticator authenticator;
    final ReputationLedger ledger;
    final Marketplace market;
    final CommandDispatcher dispatcher;

    TestNode(final SoulwireConfig config) {
        this(config, null);
    }

    /**
     * @param relay base transport; null installs {@link BasicRelay}
     */
    TestNode(final SoulwireConfig config, final Relay relay) {
        authenticator = new SoulAuthenticator(registry, clock, config.challengeTtl());
        ledger = new ReputationLedger(new InMemoryJournal<>(), signer, authenticator, config.maxReputationDelta(),
                clock);
        market = new Marketplace(config, new PriceTimePriority(), new InMemoryJournal<>(), clock, signer, ledger,
                new MarketNotifier(sessions, config.tradeCredit()));
        dispatcher = new CommandDispatcher(config, registry, authenticator, signer, ledger, market, sessions,
                relay != null ? relay : new BasicRelay(sessions, authenticator), clock);
    }

    static PrivateKey key(final int n) {
        return PrivateKey.fromHex(String.format("%064x", n));
    }

    Client connect() {
        final RecordingOutbound out = new RecordingOutbound();
        return new Client(dispatcher.connected(out), out);
    }

    /**
     * Connects, registers {@code id} with key {@code n} and authenticates.
     */
    Client login(final String id, final int n) {
        final Client client = connect();
        client.register(id, n);
        client.authenticate(id, n);
        client.out.drain();
        return client;
    }

    final class Client {
        final Session session;
        final RecordingOutbound out;

        Client(final Session session, final RecordingOutbound out) {
            this.session = session;
            this.out = out;
        }

        /**
         * Sends a line and returns the last reply.
         */
        String send(final String line) {
            dispatcher.dispatch(session, line, out);
            return out.last();
        }

        String register(final String id, final int n) {
            final PrivateKey key = key(n);
            final String proof = SoulSigner.sign(key, CommandDispatcher.REGISTRATION_PREFIX + id).toHex();
            return send("SOUL REGISTER " + id + " " + key.publicKey().toHex() + " " + proof);
        }

        String authenticate(final String id, final int n) {
            final String[] challenge = send("SOUL " + id).split(" ");
            if (!"SOUL_CHALLENGE".equals(challenge[0])) {
                return String.join(" ", challenge);
            }
            return send("SOUL " + id + " " + SoulSigner.sign(key(n), challenge[2]).toHex());
        }

        void disconnect() {
            dispatcher.disconnected(session);
        }
    }
}
