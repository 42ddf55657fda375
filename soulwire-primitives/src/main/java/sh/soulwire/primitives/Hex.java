// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for wire tokens.
 *
 * <p>Keys, signatures and nonces travel over the line protocol as lowercase hex with
 * a {@code 0x} prefix. Decoding accepts either case and an optional prefix so clients
 * written against other toolkits interoperate.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  digits, or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + abbreviate(hexString));
        }

        final byte[] result = new byte[digits / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Decodes a hex string that must describe exactly {@code expectedLength} bytes.
     *
     * @param hexString      the string to decode
     * @param expectedLength the required number of bytes
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is not valid hex of that length
     */
    public static byte[] decodeExact(final String hexString, final int expectedLength) {
        final byte[] bytes = decode(hexString);
        if (bytes.length != expectedLength) {
            throw new IllegalArgumentException(
                    "expected " + expectedLength + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return encode(bytes, true);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without prefix
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        return encode(bytes, false);
    }

    /**
     * Returns true when the string is non-empty, even-length hex (prefix optional).
     */
    public static boolean isHex(final String value) {
        if (value == null) {
            return false;
        }
        final int start = hasPrefix(value) ? 2 : 0;
        final int digits = value.length() - start;
        if (digits == 0 || (digits & 1) == 1) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= 128 || NIBBLE_LOOKUP[c] < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks for a {@code 0x} or {@code 0X} prefix.
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static String encode(final byte[] bytes, final boolean withPrefix) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final int offset = withPrefix ? 2 : 0;
        final char[] chars = new char[offset + bytes.length * 2];
        if (withPrefix) {
            chars[0] = '0';
            chars[1] = 'x';
        }
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[offset + i * 2] = HEX_CHARS[v >>> 4];
            chars[offset + i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    private static int toNibble(final char c, final String source) {
        final int value = c < 128 ? NIBBLE_LOOKUP[c] : -1;
        if (value < 0) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' in " + abbreviate(source));
        }
        return value;
    }

    private static String abbreviate(final String source) {
        return source.length() <= 24 ? source : source.substring(0, 24) + "...";
    }
}
