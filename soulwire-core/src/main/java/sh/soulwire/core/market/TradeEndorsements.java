// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.reputation.ReputationEvent;

/**
 * The reputation events a settled trade produces.
 *
 * <p>
 * Settlement yields two symmetric events: the seeker endorses the provider and the
 * provider endorses the seeker. Each event id is {@code trade:<tradeId>:<endorser>},
 * so resubmitting a settlement can never credit a party twice.
 *
 * @since 0.1.0
 */
public final class TradeEndorsements {

    public static final String REASON = "TRADE_SETTLED";

    private TradeEndorsements() {
    }

    public static String eventId(final Trade trade, final Role endorser) {
        return ReputationEvent.SETTLEMENT_PREFIX + trade.tradeId() + ":" + trade.party(endorser).value();
    }

    /**
     * Returns the payload the party in {@code endorser} role signs to accept the trade.
     */
    public static String payload(final Trade trade, final Role endorser, final long credit) {
        final SoulId from = trade.party(endorser);
        final SoulId to = trade.party(endorser.counterpart());
        return ReputationEvent.canonicalPayload(eventId(trade, endorser), to, credit, REASON, from);
    }

    /**
     * Builds the signed event issued by the party in {@code endorser} role.
     */
    public static ReputationEvent event(
            final Trade trade,
            final Role endorser,
            final long credit,
            final Signature signature) {
        return new ReputationEvent(
                eventId(trade, endorser),
                trade.party(endorser.counterpart()),
                credit,
                REASON,
                trade.party(endorser),
                signature);
    }
}
