// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.identity;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

import sh.soulwire.core.crypto.SoulKey;

/**
 * A registered identity: id, public verification key and optional display tags.
 * Immutable once registered.
 *
 * @param id        unique soul id
 * @param key       public verification key, never changes
 * @param paradigm  optional paradigm tag shown in annotations
 * @param mode      optional mode tag, e.g. {@code REAL} or {@code LIGHT}
 * @param createdAt registration time
 * @since 0.1.0
 */
public record Soul(SoulId id, SoulKey key, @Nullable String paradigm, @Nullable String mode, Instant createdAt) {

    private static final Pattern TAG = Pattern.compile("[A-Za-z0-9._-]{1,32}");

    public Soul {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(createdAt, "createdAt");
        if (paradigm != null && !TAG.matcher(paradigm).matches()) {
            throw new IllegalArgumentException("Invalid paradigm tag: " + paradigm);
        }
        if (mode != null) {
            if (!TAG.matcher(mode).matches()) {
                throw new IllegalArgumentException("Invalid mode tag: " + mode);
            }
            mode = mode.toUpperCase(Locale.ROOT);
        }
    }

    public static Soul of(final SoulId id, final SoulKey key, final Instant createdAt) {
        return new Soul(id, key, null, null, createdAt);
    }

    /**
     * Returns the display annotation {@code [Soul:id] [Paradigm:p] [Mode:m]},
     * omitting absent tags.
     */
    public String annotation() {
        final StringBuilder sb = new StringBuilder("[Soul:").append(id.value()).append(']');
        if (paradigm != null) {
            sb.append(" [Paradigm:").append(paradigm).append(']');
        }
        if (mode != null) {
            sb.append(" [Mode:").append(mode).append(']');
        }
        return sb.toString();
    }
}
