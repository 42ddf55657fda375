// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.time.Instant;

import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.store.ListingRecord;
import sh.soulwire.core.store.TradeRecord;

/**
 * Conversions between market snapshots and their journal records.
 */
final class MarketRecords {

    private MarketRecords() {
    }

    static ListingRecord toRecord(final ServiceListing listing) {
        return new ListingRecord(
                listing.listingId(),
                listing.side().name(),
                listing.category().value(),
                listing.price().units(),
                listing.owner().value(),
                listing.sessionId(),
                listing.sequence(),
                listing.createdAt().toEpochMilli(),
                listing.expiresAt().toEpochMilli(),
                listing.status().name());
    }

    static ServiceListing fromRecord(final ListingRecord record) {
        return new ServiceListing(
                record.listingId(),
                Side.valueOf(record.side()),
                Category.of(record.category()),
                Price.of(record.price()),
                SoulId.of(record.owner()),
                record.sessionId(),
                record.sequence(),
                Instant.ofEpochMilli(record.createdAtMillis()),
                Instant.ofEpochMilli(record.expiresAtMillis()),
                ListingStatus.valueOf(record.status()));
    }

    static TradeRecord toRecord(final Trade trade) {
        return new TradeRecord(
                trade.tradeId(),
                trade.offerId(),
                trade.requestId(),
                trade.category().value(),
                trade.price().units(),
                trade.provider().value(),
                trade.seeker().value(),
                trade.status().name(),
                trade.createdAt().toEpochMilli(),
                trade.deadline().toEpochMilli(),
                trade.providerSignature() == null ? null : trade.providerSignature().toHex(),
                trade.seekerSignature() == null ? null : trade.seekerSignature().toHex());
    }

    static Trade fromRecord(final TradeRecord record) {
        return new Trade(
                record.tradeId(),
                record.offerId(),
                record.requestId(),
                Category.of(record.category()),
                Price.of(record.price()),
                SoulId.of(record.provider()),
                SoulId.of(record.seeker()),
                TradeStatus.valueOf(record.status()),
                Instant.ofEpochMilli(record.createdAtMillis()),
                Instant.ofEpochMilli(record.deadlineMillis()),
                record.providerSignature() == null ? null : Signature.fromHex(record.providerSignature()),
                record.seekerSignature() == null ? null : Signature.fromHex(record.seekerSignature()));
    }

    /**
     * Parses the numeric suffix of an id such as {@code L42}; 0 if there is none.
     */
    static long counterOf(final String id) {
        if (id.length() < 2) {
            return 0;
        }
        try {
            return Long.parseLong(id.substring(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
