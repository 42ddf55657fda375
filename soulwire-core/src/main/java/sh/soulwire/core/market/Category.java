// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.soulwire.core.error.ProtocolException;

/**
 * Service category, case-folded to lower case. Each category has its own order book.
 *
 * @param value normalized category name, {@code [a-z0-9][a-z0-9_-]*}
 * @since 0.1.0
 */
public record Category(String value) {

    private static final Pattern VALID = Pattern.compile("[a-z0-9][a-z0-9_-]{0,63}");

    public Category {
        Objects.requireNonNull(value, "value");
        value = value.toLowerCase(Locale.ROOT);
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid category: " + value);
        }
    }

    public static Category of(final String value) {
        return new Category(value);
    }

    /**
     * Parses a wire category token.
     *
     * @throws ProtocolException if the token is not a valid category
     */
    public static Category parse(final String token) {
        try {
            return new Category(token);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("invalid category " + token);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
