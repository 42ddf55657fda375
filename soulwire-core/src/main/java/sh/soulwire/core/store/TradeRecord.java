// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

/**
 * Journal form of a trade. Acceptance signatures are hex, null until recorded.
 */
public record TradeRecord(
        String tradeId,
        String offerId,
        String requestId,
        String category,
        long price,
        String provider,
        String seeker,
        String status,
        long createdAtMillis,
        long deadlineMillis,
        String providerSignature,
        String seekerSignature) implements MarketRecord {
}
