// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.identity;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Opaque soul identifier: 1 to 128 characters of {@code [A-Za-z0-9._:-]}.
 *
 * <p>Ids are case-sensitive and never contain whitespace, so they are always a
 * single wire token. The {@code SOUL} sub-command names ({@code register},
 * {@code info}, {@code endorse}) are reserved in any case.
 *
 * @param value the identifier
 * @since 0.1.0
 */
public record SoulId(String value) {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");
    private static final Set<String> RESERVED = Set.of("register", "info", "endorse");

    public SoulId {
        Objects.requireNonNull(value, "value");
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid soul id: " + abbreviate(value));
        }
        if (isReserved(value)) {
            throw new IllegalArgumentException("Reserved soul id: " + value);
        }
    }

    public static SoulId of(final String value) {
        return new SoulId(value);
    }

    /**
     * Returns true if {@code value} is a well-formed soul id.
     */
    public static boolean isValid(final String value) {
        return value != null && VALID.matcher(value).matches() && !isReserved(value);
    }

    private static boolean isReserved(final String value) {
        return RESERVED.contains(value.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return value;
    }

    private static String abbreviate(final String value) {
        return value.length() <= 32 ? value : value.substring(0, 32) + "...";
    }
}
