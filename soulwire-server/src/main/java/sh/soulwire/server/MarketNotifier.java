// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.market.MarketListener;
import sh.soulwire.core.market.Role;
import sh.soulwire.core.market.ServiceListing;
import sh.soulwire.core.market.Trade;
import sh.soulwire.core.market.TradeEndorsements;

/**
 * Pushes trade and listing events to the sessions of the souls involved.
 *
 * <p>
 * A proposal tells each party its role and the exact endorsement payload it must
 * sign to accept:
 * {@code TRADE <trade_id> PROPOSED <category> <price> <role> <payload>}. Settlement
 * and abort are {@code TRADE <trade_id> SETTLED} and {@code TRADE <trade_id> ABORTED}.
 * A closed listing is reported to the session that placed it as
 * {@code LISTING_CLOSED <listing_id> <status>}. Parties with no live session miss
 * the notification; the trade itself is unaffected.
 *
 * @since 0.1.0
 */
public final class MarketNotifier implements MarketListener {

    private static final Logger log = LoggerFactory.getLogger(MarketNotifier.class);

    private final SessionRegistry sessions;
    private final long tradeCredit;

    public MarketNotifier(final SessionRegistry sessions, final long tradeCredit) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.tradeCredit = tradeCredit;
    }

    @Override
    public void onTradeProposed(final Trade trade) {
        for (Role role : Role.values()) {
            final String line = "TRADE " + trade.tradeId() + " PROPOSED " + trade.category() + " " + trade.price()
                    + " " + role + " " + TradeEndorsements.payload(trade, role, tradeCredit);
            notify(trade, role, line);
        }
    }

    @Override
    public void onTradeSettled(final Trade trade) {
        notifyBoth(trade, "TRADE " + trade.tradeId() + " SETTLED");
    }

    @Override
    public void onTradeAborted(final Trade trade) {
        notifyBoth(trade, "TRADE " + trade.tradeId() + " ABORTED");
    }

    @Override
    public void onListingClosed(final ServiceListing listing) {
        sessions.find(listing.sessionId()).ifPresent(connection -> connection.outbound()
                .send("LISTING_CLOSED " + listing.listingId() + " " + listing.status()));
    }

    private void notifyBoth(final Trade trade, final String line) {
        for (Role role : Role.values()) {
            notify(trade, role, line);
        }
    }

    private void notify(final Trade trade, final Role role, final String line) {
        if (sessions.sendTo(trade.party(role), line) == 0) {
            log.debug("No live session for {} of trade {}", trade.party(role), trade.tradeId());
        }
    }
}
