// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.util.Optional;

import sh.soulwire.core.identity.SoulId;

/**
 * Supplies a soul's private key for a single signing call.
 *
 * <p>
 * Key generation and secure storage belong to the client or to an external
 * custodian. The node only asks for a key when a session requests a server-side
 * signature ({@code SIGN}, or {@code SERVICE ACCEPT} without an explicit signature).
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface KeyCustody {

    /**
     * Returns the key held for {@code soul}, if any.
     */
    Optional<PrivateKey> keyFor(SoulId soul);

    /**
     * Custody that holds no keys: every server-side signature request fails with
     * {@code ERR_NO_KEY}.
     */
    static KeyCustody none() {
        return soul -> Optional.empty();
    }
}
