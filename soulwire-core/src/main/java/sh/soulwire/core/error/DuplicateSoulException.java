// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when registering a soul id that already exists. Registered keys never change.
 *
 * @since 0.1.0
 */
public final class DuplicateSoulException extends IdentityException {

    public DuplicateSoulException(final String soulId) {
        super(ReplyCode.ERR_DUPLICATE_SOUL, "Soul already registered: " + soulId);
    }
}
