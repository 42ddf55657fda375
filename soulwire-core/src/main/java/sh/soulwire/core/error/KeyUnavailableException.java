// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

/**
 * Thrown when a signature is requested for a soul whose private key is not held in custody.
 *
 * @since 0.1.0
 */
public final class KeyUnavailableException extends IdentityException {

    public KeyUnavailableException(final String soulId) {
        super(ReplyCode.ERR_NO_KEY, "No signing key in custody for soul " + soulId);
    }
}
