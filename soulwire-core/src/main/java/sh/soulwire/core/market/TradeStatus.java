// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

/**
 * Trade handshake states. SETTLED and ABORTED are final.
 *
 * @since 0.1.0
 */
public enum TradeStatus {
    PROPOSED,
    ACCEPTED_BY_SEEKER,
    ACCEPTED_BY_PROVIDER,
    SETTLED,
    ABORTED;

    public boolean isTerminal() {
        return this == SETTLED || this == ABORTED;
    }
}
