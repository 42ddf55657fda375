// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a signed acceptance or endorsement does not verify against the
 * signer's registered key.
 *
 * @since 0.1.0
 */
public final class InvalidSignatureException extends MarketException {

    public InvalidSignatureException(final String message) {
        super(ReplyCode.ERR_INVALID_SIGNATURE, message);
    }
}
