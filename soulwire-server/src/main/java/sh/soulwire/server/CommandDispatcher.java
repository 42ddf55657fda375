// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.auth.AuthChallenge;
import sh.soulwire.core.auth.AuthResult;
import sh.soulwire.core.auth.Session;
import sh.soulwire.core.auth.SoulAuthenticator;
import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.crypto.SignedMessage;
import sh.soulwire.core.crypto.SoulKey;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.error.InvalidSignatureException;
import sh.soulwire.core.error.MarketStateException;
import sh.soulwire.core.error.NotAuthenticatedException;
import sh.soulwire.core.error.ProtocolException;
import sh.soulwire.core.error.RegistrationClosedException;
import sh.soulwire.core.error.ReplyCode;
import sh.soulwire.core.error.SoulwireException;
import sh.soulwire.core.error.UnknownTradeException;
import sh.soulwire.core.identity.IdentityRegistry;
import sh.soulwire.core.identity.Soul;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.market.Category;
import sh.soulwire.core.market.Marketplace;
import sh.soulwire.core.market.Price;
import sh.soulwire.core.market.Role;
import sh.soulwire.core.market.ServiceListing;
import sh.soulwire.core.market.Side;
import sh.soulwire.core.market.Trade;
import sh.soulwire.core.market.TradeEndorsements;
import sh.soulwire.core.reputation.ReputationEvent;
import sh.soulwire.core.reputation.ReputationLedger;
import sh.soulwire.core.reputation.SubmitResult;

/**
 * Parses extension commands and routes them to the core components.
 *
 * <p>
 * This is the only class aware of the wire syntax. Verbs and sub-commands are
 * case-insensitive:
 *
 * <pre>
 * SOUL &lt;id&gt;                                   SOUL_CHALLENGE &lt;id&gt; &lt;nonce&gt;
 * SOUL &lt;id&gt; &lt;signature&gt;                       AUTH_OK &lt;id&gt; [REPLACED &lt;old&gt;]
 * SOUL REGISTER &lt;id&gt; &lt;key&gt; &lt;proof&gt; [p] [m]    SOUL_REGISTERED &lt;id&gt;
 * SOUL INFO &lt;id&gt;                              SOUL_INFO &lt;id&gt; &lt;score&gt; [annotation]
 * SOUL ENDORSE &lt;evt&gt; &lt;subject&gt; &lt;delta&gt; &lt;reason&gt; &lt;sig&gt;
 *                                            ENDORSE_ACCEPTED | ENDORSE_DUPLICATE &lt;evt&gt;
 * SERVICE LIST                               LISTING ... then LIST_END &lt;n&gt;
 * SERVICE OFFER|REQUEST &lt;category&gt; &lt;price&gt;   LISTED &lt;listing_id&gt; &lt;status&gt;
 * SERVICE CANCEL &lt;listing_id&gt;                 CANCELLED &lt;listing_id&gt;
 * SERVICE ACCEPT &lt;trade_id&gt; [signature]      ACCEPTED &lt;trade_id&gt; &lt;status&gt;
 * SIGN &lt;payload...&gt;                          SIGNATURE &lt;hex&gt;
 * </pre>
 *
 * <p>
 * Authentication and {@code SOUL REGISTER} are open to anonymous sessions; every
 * other extension command requires a bound soul. Anything else goes to the
 * {@link Relay}.
 *
 * <p>
 * Failures never escape: a {@link SoulwireException} becomes its reply code and
 * any other runtime failure becomes {@code ERR_INTERNAL}. The connection is never
 * closed here.
 *
 * @since 0.1.0
 */
public final class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    /** Message a registering client signs to prove possession of its key. */
    static final String REGISTRATION_PREFIX = "register:";

    private final IdentityRegistry registry;
    private final SoulAuthenticator authenticator;
    private final SoulSigner signer;
    private final ReputationLedger ledger;
    private final Marketplace market;
    private final SessionRegistry sessions;
    private final Relay relay;
    private final Clock clock;
    private final boolean registrationOpen;
    private final long tradeCredit;

    public CommandDispatcher(
            final SoulwireConfig config,
            final IdentityRegistry registry,
            final SoulAuthenticator authenticator,
            final SoulSigner signer,
            final ReputationLedger ledger,
            final Marketplace market,
            final SessionRegistry sessions,
            final Relay relay,
            final Clock clock) {
        Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.market = Objects.requireNonNull(market, "market");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registrationOpen = config.isRegistrationOpen();
        this.tradeCredit = config.tradeCredit();
    }

    /**
     * Opens a session for a new connection.
     */
    public Session connected(final Outbound outbound) {
        return sessions.open(outbound);
    }

    /**
     * Handles one line from {@code session}, writing any replies to {@code out}.
     * Blank lines are ignored.
     */
    public void dispatch(final Session session, final String line, final Outbound out) {
        if (line == null || line.isBlank()) {
            return;
        }
        try {
            final CommandLine command = CommandLine.parse(line);
            switch (command.verb()) {
                case "SOUL" -> soul(session, command, out);
                case "SERVICE" -> service(session, command, out);
                case "SIGN" -> sign(session, command, out);
                default -> relay.relay(session, command, out);
            }
        } catch (SoulwireException e) {
            log.debug("Session {} command failed: {} {}", session.id(), e.replyCode(), e.getMessage());
            out.send(e.replyCode().format(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling a command from session {}", session.id(), e);
            out.send(ReplyCode.ERR_INTERNAL.format("internal error"));
        }
    }

    /**
     * Releases everything the session held: its challenge, its soul binding and
     * its OPEN listings.
     */
    public void disconnected(final Session session) {
        sessions.close(session);
        authenticator.sessionClosed(session);
        try {
            market.sessionClosed(session.id());
        } catch (SoulwireException e) {
            log.warn("Could not cancel listings of closed session {}", session.id(), e);
        }
    }

    // SOUL

    private void soul(final Session session, final CommandLine command, final Outbound out) {
        switch (command.subcommand()) {
            case "" -> throw new ProtocolException("SOUL: missing soul id");
            case "REGISTER" -> register(command, out);
            case "INFO" -> info(session, command, out);
            case "ENDORSE" -> endorse(session, command, out);
            default -> authenticate(session, command, out);
        }
    }

    private void authenticate(final Session session, final CommandLine command, final Outbound out) {
        final SoulId soulId = soulId(command.arg(0, "soul id"));
        if (command.argCount() == 1) {
            final AuthChallenge challenge = authenticator.beginAuth(session, soulId);
            out.send("SOUL_CHALLENGE " + soulId + " " + challenge.nonce());
            return;
        }
        if (command.argCount() > 2) {
            throw new ProtocolException("SOUL: expected <id> [signature]");
        }
        final AuthResult result = authenticator.respond(session, soulId, Signature.tryParse(command.arg(1, "signature")));
        switch (result.status()) {
            case AUTHENTICATED -> {
                final Soul replaced = result.replaced();
                out.send(replaced == null
                        ? "AUTH_OK " + soulId
                        : "AUTH_OK " + soulId + " REPLACED " + replaced.id());
            }
            case AUTH_FAILED -> out.send(ReplyCode.ERR_AUTH_FAILED.format(soulId.value()));
            case CHALLENGE_EXPIRED -> out.send(ReplyCode.ERR_CHALLENGE_EXPIRED.format(soulId.value()));
        }
    }

    private void register(final CommandLine command, final Outbound out) {
        if (!registrationOpen) {
            throw new RegistrationClosedException();
        }
        if (command.argCount() < 4 || command.argCount() > 6) {
            throw new ProtocolException("SOUL REGISTER: expected <id> <key> <proof> [paradigm] [mode]");
        }
        final SoulId soulId = soulId(command.arg(1, "soul id"));
        final SoulKey key;
        try {
            key = SoulKey.fromHex(command.arg(2, "public key"));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("SOUL REGISTER: invalid public key");
        }
        final Signature proof = Signature.tryParse(command.arg(3, "proof"));
        if (proof == null || !SoulSigner.verify(key, REGISTRATION_PREFIX + soulId.value(), proof)) {
            throw new InvalidSignatureException("proof of possession does not verify");
        }
        final String paradigm = command.argCount() > 4 ? command.args().get(4) : null;
        final String mode = command.argCount() > 5 ? command.args().get(5) : null;
        final Soul soul;
        try {
            soul = new Soul(soulId, key, paradigm, mode, clock.instant());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("SOUL REGISTER: " + e.getMessage());
        }
        registry.register(soul);
        out.send("SOUL_REGISTERED " + soulId);
    }

    private void info(final Session session, final CommandLine command, final Outbound out) {
        requireSoul(session, "SOUL INFO");
        final Soul soul = registry.require(soulId(command.arg(1, "soul id")));
        out.send("SOUL_INFO " + soul.id() + " " + ledger.scoreOf(soul.id()) + " " + soul.annotation());
    }

    private void endorse(final Session session, final CommandLine command, final Outbound out) {
        final SoulId endorser = requireSoul(session, "SOUL ENDORSE");
        if (command.argCount() != 6) {
            throw new ProtocolException("SOUL ENDORSE: expected <event_id> <subject> <delta> <reason> <signature>");
        }
        final String eventId = command.args().get(1);
        final SoulId subject = soulId(command.args().get(2));
        final long delta;
        try {
            delta = Long.parseLong(command.args().get(3));
        } catch (NumberFormatException e) {
            throw new ProtocolException("SOUL ENDORSE: invalid delta " + command.args().get(3));
        }
        final Signature signature = Signature.tryParse(command.args().get(5));
        if (signature == null) {
            throw new InvalidSignatureException("malformed endorsement signature");
        }
        registry.require(subject);
        final ReputationEvent event;
        try {
            event = new ReputationEvent(eventId, subject, delta, command.args().get(4), endorser, signature);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("SOUL ENDORSE: " + e.getMessage());
        }

        final SubmitResult result = ledger.submit(event);
        switch (result) {
            case ACCEPTED -> out.send("ENDORSE_ACCEPTED " + eventId);
            case DUPLICATE -> out.send("ENDORSE_DUPLICATE " + eventId);
            case REJECTED -> out.send(ReplyCode.ERR_REJECTED.format(eventId));
        }
    }

    // SERVICE

    private void service(final Session session, final CommandLine command, final Outbound out) {
        final SoulId soul = requireSoul(session, "SERVICE");
        switch (command.subcommand()) {
            case "LIST" -> list(out);
            case "OFFER" -> place(session, soul, Side.OFFER, command, out);
            case "REQUEST" -> place(session, soul, Side.REQUEST, command, out);
            case "CANCEL" -> {
                final ServiceListing cancelled = market.cancel(soul, command.arg(1, "listing id"));
                out.send("CANCELLED " + cancelled.listingId());
            }
            case "ACCEPT" -> accept(soul, command, out);
            case "" -> throw new ProtocolException("SERVICE: missing sub-command");
            default -> throw new ProtocolException(ReplyCode.ERR_UNKNOWN_COMMAND, "SERVICE " + command.subcommand());
        }
    }

    private void list(final Outbound out) {
        final List<ServiceListing> open = market.openListings();
        for (ServiceListing listing : open) {
            out.send("LISTING " + listing.listingId() + " " + listing.side() + " " + listing.category() + " "
                    + listing.price() + " " + listing.owner());
        }
        out.send("LIST_END " + open.size());
    }

    private void place(
            final Session session,
            final SoulId soul,
            final Side side,
            final CommandLine command,
            final Outbound out) {
        final Category category = Category.parse(command.arg(1, "category"));
        final Price price = Price.parse(command.arg(2, "price"));
        final ServiceListing listing = market.list(soul, session.id(), side, category, price);
        out.send("LISTED " + listing.listingId() + " " + listing.status());
    }

    private void accept(final SoulId soul, final CommandLine command, final Outbound out) {
        final String tradeId = command.arg(1, "trade id");
        final Signature endorsement;
        if (command.argCount() > 2) {
            endorsement = Signature.tryParse(command.args().get(2));
            if (endorsement == null) {
                throw new InvalidSignatureException("malformed acceptance signature");
            }
        } else {
            // No signature on the line: sign through key custody.
            final Trade trade = market.trade(tradeId).orElseThrow(() -> new UnknownTradeException(tradeId));
            final Role role = trade.roleOf(soul)
                    .orElseThrow(() -> new MarketStateException(soul + " is not a party to trade " + tradeId));
            endorsement = signer.sign(soul, TradeEndorsements.payload(trade, role, tradeCredit));
        }
        final Trade updated = market.accept(soul, tradeId, endorsement);
        out.send("ACCEPTED " + updated.tradeId() + " " + updated.status());
    }

    // SIGN

    private void sign(final Session session, final CommandLine command, final Outbound out) {
        final SoulId soul = requireSoul(session, "SIGN");
        final String payload = command.rest();
        if (payload.isEmpty()) {
            throw new ProtocolException("SIGN: missing payload");
        }
        final SignedMessage signed = signer.signMessage(soul, payload);
        session.attachSignature(signed);
        out.send("SIGNATURE " + signed.signature().toHex());
    }

    private static SoulId requireSoul(final Session session, final String command) {
        return session.soulId().orElseThrow(() -> new NotAuthenticatedException(command));
    }

    private static SoulId soulId(final String token) {
        if (!SoulId.isValid(token)) {
            throw new ProtocolException("invalid soul id " + token);
        }
        return SoulId.of(token);
    }
}
