// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.auth;

import sh.soulwire.core.identity.SoulId;

/**
 * View of which souls currently hold an authenticated session.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AuthenticationStatus {

    /**
     * Returns true while at least one live session is bound to {@code soul}.
     */
    boolean isAuthenticated(SoulId soul);
}
