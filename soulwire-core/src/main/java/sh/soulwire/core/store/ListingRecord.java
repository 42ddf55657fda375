// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

/**
 * Journal form of a service listing.
 */
public record ListingRecord(
        String listingId,
        String side,
        String category,
        long price,
        String owner,
        String sessionId,
        long sequence,
        long createdAtMillis,
        long expiresAtMillis,
        String status) implements MarketRecord {
}
