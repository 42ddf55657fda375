// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

/**
 * Callbacks for market transitions, used by the transport to notify parties.
 *
 * <p>
 * Callbacks run on the thread that caused the transition, after the order book lock
 * is released. Implementations should be fast and must not throw; the marketplace
 * logs and ignores listener failures. All methods default to no-ops.
 *
 * @since 0.1.0
 */
public interface MarketListener {

    /**
     * A trade was created by a match.
     */
    default void onTradeProposed(Trade trade) {
    }

    /**
     * Both parties accepted and the settlement endorsements were submitted.
     */
    default void onTradeSettled(Trade trade) {
    }

    /**
     * The trade missed its deadline.
     */
    default void onTradeAborted(Trade trade) {
    }

    /**
     * An OPEN listing was cancelled or expired.
     */
    default void onListingClosed(ServiceListing listing) {
    }

    /**
     * Returns a listener that ignores every callback.
     */
    static MarketListener noop() {
        return NoopMarketListener.INSTANCE;
    }
}

/**
 * No-op implementation of MarketListener.
 */
enum NoopMarketListener implements MarketListener {
    INSTANCE
}
