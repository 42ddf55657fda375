// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.reputation;

import java.util.Objects;
import java.util.regex.Pattern;

import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.identity.SoulId;

/**
 * A signed endorsement that moves a soul's reputation by {@code delta}.
 *
 * <p>
 * The endorser signs {@link #canonicalPayload()} with its soul key. The event id is
 * chosen by the submitter and is the dedup key: a second event with the same id is
 * never applied, whatever its other fields say. Ids starting with
 * {@value #SETTLEMENT_PREFIX} belong to trade settlement and are only admitted
 * through {@link ReputationLedger#submitSettlement}.
 *
 * @param eventId   caller-supplied unique id
 * @param subject   soul whose score changes
 * @param delta     signed score change
 * @param reason    reason code, {@code [A-Z][A-Z0-9_]*}
 * @param endorser  soul issuing the event
 * @param signature endorser's signature over the canonical payload
 * @since 0.1.0
 */
public record ReputationEvent(
        String eventId,
        SoulId subject,
        long delta,
        String reason,
        SoulId endorser,
        Signature signature) {

    /** Id namespace of the events a settled trade produces. */
    public static final String SETTLEMENT_PREFIX = "trade:";

    private static final Pattern EVENT_ID = Pattern.compile("[A-Za-z0-9._:-]{1,160}");
    private static final Pattern REASON = Pattern.compile("[A-Z][A-Z0-9_]{0,63}");

    public ReputationEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(endorser, "endorser");
        Objects.requireNonNull(signature, "signature");
        if (!EVENT_ID.matcher(eventId).matches()) {
            throw new IllegalArgumentException("Invalid event id: " + eventId);
        }
        if (!REASON.matcher(reason).matches()) {
            throw new IllegalArgumentException("Invalid reason code: " + reason);
        }
    }

    /**
     * Returns the string the endorser signs for these event fields.
     */
    public static String canonicalPayload(
            final String eventId,
            final SoulId subject,
            final long delta,
            final String reason,
            final SoulId endorser) {
        return "reputation:v1|" + eventId + "|" + subject.value() + "|" + delta + "|" + reason + "|"
                + endorser.value();
    }

    public String canonicalPayload() {
        return canonicalPayload(eventId, subject, delta, reason, endorser);
    }

    /**
     * Returns true if the id lies in the settlement namespace.
     */
    public boolean isSettlement() {
        return isSettlementId(eventId);
    }

    public static boolean isSettlementId(final String eventId) {
        return eventId.regionMatches(true, 0, SETTLEMENT_PREFIX, 0, SETTLEMENT_PREFIX.length());
    }
}
