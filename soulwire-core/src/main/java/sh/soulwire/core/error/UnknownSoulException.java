// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a soul id is not present in the identity registry.
 *
 * @since 0.1.0
 */
public final class UnknownSoulException extends IdentityException {

    private final String soulId;

    public UnknownSoulException(final String soulId) {
        super(ReplyCode.ERR_UNKNOWN_SOUL, "Unknown soul: " + soulId);
        this.soulId = soulId;
    }

    public String soulId() {
        return soulId;
    }
}
