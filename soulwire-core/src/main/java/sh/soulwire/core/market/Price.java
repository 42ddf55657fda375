// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import sh.soulwire.core.error.InvalidPriceException;

/**
 * A listing price in whole units. Always positive.
 *
 * @param units price in integer units
 * @since 0.1.0
 */
public record Price(long units) implements Comparable<Price> {

    public Price {
        if (units <= 0) {
            throw new InvalidPriceException(Long.toString(units));
        }
    }

    public static Price of(final long units) {
        return new Price(units);
    }

    /**
     * Parses a wire price token.
     *
     * @throws InvalidPriceException if the token is not a positive integer
     */
    public static Price parse(final String token) {
        if (token == null || token.isEmpty() || token.length() > 19) {
            throw new InvalidPriceException(String.valueOf(token));
        }
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidPriceException(token);
            }
        }
        try {
            return new Price(Long.parseLong(token));
        } catch (NumberFormatException e) {
            throw new InvalidPriceException(token);
        }
    }

    @Override
    public int compareTo(final Price other) {
        return Long.compare(units, other.units);
    }

    @Override
    public String toString() {
        return Long.toString(units);
    }
}
