// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

/**
 * A party's role in a trade.
 *
 * @since 0.1.0
 */
public enum Role {
    /** Owner of the offer. */
    PROVIDER,
    /** Owner of the request. */
    SEEKER;

    public Role counterpart() {
        return this == PROVIDER ? SEEKER : PROVIDER;
    }
}
