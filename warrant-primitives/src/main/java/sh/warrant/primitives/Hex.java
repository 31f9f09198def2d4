// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.primitives;

/**
 * Hex codec for {@code 0x}-prefixed strings as they appear in signed messages,
 * addresses and hashes.
 *
 * <p>Output is always lowercase. Input may use either case, with or without prefix.
 *
 * @since 0.1.0
 */
public final class Hex {

    private static final String PREFIX = "0x";
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    /**
     * Parses hex text into bytes.
     *
     * @param text digits, optionally prefixed with {@code 0x} or {@code 0X}
     * @return the bytes; empty for {@code ""} and {@code "0x"}
     * @throws IllegalArgumentException if the text is null, has an odd digit count
     *                                  or contains a non-hex character
     */
    public static byte[] decode(final String text) {
        final String digits = cleanPrefix(text);
        if ((digits.length() % 2) != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + text);
        }
        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0, j = 0; i < out.length; i++, j += 2) {
            out[i] = (byte) (digit(digits.charAt(j), text) << 4 | digit(digits.charAt(j + 1), text));
        }
        return out;
    }

    /**
     * Formats bytes as {@code 0x}-prefixed lowercase hex.
     *
     * @param bytes the bytes
     * @return the hex text
     */
    public static String encode(final byte[] bytes) {
        return PREFIX + encodeNoPrefix(bytes);
    }

    /**
     * Formats bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes
     * @return the hex digits
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X}.
     *
     * @param text the hex text
     * @return the digits
     * @throws IllegalArgumentException if {@code text} is null
     */
    public static String cleanPrefix(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(text) ? text.substring(PREFIX.length()) : text;
    }

    public static boolean hasPrefix(final String text) {
        return text != null && text.regionMatches(true, 0, PREFIX, 0, PREFIX.length());
    }

    private static int digit(final char c, final String input) {
        final int value = Character.digit(c, 16);
        if (value < 0 || c > 'f') {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return value;
    }
}
