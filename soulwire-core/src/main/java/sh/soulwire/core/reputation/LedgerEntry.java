// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.reputation;

import java.time.Instant;
import java.util.Objects;

/**
 * An accepted event with its admission time.
 *
 * @since 0.1.0
 */
public record LedgerEntry(ReputationEvent event, Instant admittedAt) {

    public LedgerEntry {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(admittedAt, "admittedAt");
    }
}
