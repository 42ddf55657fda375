// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.reputation;

/**
 * Outcome of submitting a reputation event.
 *
 * @since 0.1.0
 */
public enum SubmitResult {
    /** Applied to the subject's score and journaled. */
    ACCEPTED,
    /** An event with this id was already accepted; nothing changed. */
    DUPLICATE,
    /** Failed admission; nothing changed. */
    REJECTED
}
