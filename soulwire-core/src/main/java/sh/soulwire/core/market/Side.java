// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.util.Locale;

/**
 * Which side of the book a listing rests on.
 *
 * @since 0.1.0
 */
public enum Side {
    /** A provider advertising a service at an asking price. */
    OFFER,
    /** A seeker asking for a service up to a maximum price. */
    REQUEST;

    public Side opposite() {
        return this == OFFER ? REQUEST : OFFER;
    }

    /**
     * Parses a side name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a side
     */
    public static Side parse(final String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
