// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core;

import java.util.regex.Pattern;

/**
 * Removes signature material from wire trace lines.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts long hex tokens (signatures, proofs, nonces)</li>
 * <li>Truncates excessively long lines</li>
 * </ul>
 * Public keys (33 bytes, 66 digits) stay visible so operators can tell souls apart.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Hex tokens of 64 digits or more, other than a 66-digit public key. */
    private static final Pattern SECRET_HEX_PATTERN =
            Pattern.compile("\\b0x(?![0-9a-fA-F]{66}\\b)[0-9a-fA-F]{64,}\\b");

    private static final String REPLACEMENT = "0x***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("0x")) {
            sanitized = SECRET_HEX_PATTERN.matcher(sanitized).replaceAll(REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
