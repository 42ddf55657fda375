// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

/**
 * Journal form of an accepted reputation event.
 *
 * @param eventId          dedup key
 * @param subject          soul whose score changes
 * @param delta            signed score change
 * @param reason           reason code
 * @param endorser         soul that signed the event
 * @param signature        endorser signature, hex
 * @param admittedAtMillis admission time, epoch millis
 */
public record ReputationRecord(
        String eventId,
        String subject,
        long delta,
        String reason,
        String endorser,
        String signature,
        long admittedAtMillis) {
}
