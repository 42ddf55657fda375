// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

/**
 * Listing lifecycle.
 *
 * <pre>
 * OPEN ──► MATCHED ──► CANCELLED (trade aborted)
 *   │
 *   ├──► CANCELLED (withdrawn, or owning session gone)
 *   └──► EXPIRED   (TTL elapsed unmatched)
 * </pre>
 *
 * A listing never returns to OPEN.
 *
 * @since 0.1.0
 */
public enum ListingStatus {
    OPEN,
    MATCHED,
    CANCELLED,
    EXPIRED;

    public boolean canTransitionTo(final ListingStatus next) {
        return switch (this) {
            case OPEN -> next == MATCHED || next == CANCELLED || next == EXPIRED;
            case MATCHED -> next == CANCELLED;
            case CANCELLED, EXPIRED -> false;
        };
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == EXPIRED;
    }
}
