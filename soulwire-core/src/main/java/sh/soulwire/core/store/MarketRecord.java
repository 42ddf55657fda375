// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Snapshot of a listing or trade written on every market transition.
 * Replay keeps the latest snapshot per id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ListingRecord.class, name = "listing"),
    @JsonSubTypes.Type(value = TradeRecord.class, name = "trade")
})
public sealed interface MarketRecord permits ListingRecord, TradeRecord {
}
