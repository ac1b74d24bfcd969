// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.primitives;

/**
 * Hex text codec for account addresses and other raw byte values.
 *
 * <p>
 * Decoding accepts an optional {@code 0x}/{@code 0X} prefix and digits of either
 * case. Encoding always produces lowercase digits.
 *
 * @since 0.1.0
 */
public final class Hex {

    private static final String PREFIX = "0x";
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
    }

    /**
     * Decodes {@code text} into bytes.
     *
     * @throws IllegalArgumentException for {@code null}, an odd digit count or a
     *                                  non-hex character
     */
    public static byte[] decode(final String text) {
        final String digits = cleanPrefix(text);
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + text);
        }
        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0, j = 0; i < out.length; i++, j += 2) {
            out[i] = (byte) (digitValue(digits.charAt(j), text) << 4 | digitValue(digits.charAt(j + 1), text));
        }
        return out;
    }

    /**
     * Encodes {@code bytes} as {@code 0x}-prefixed lowercase hex.
     *
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return PREFIX + encodeNoPrefix(bytes);
    }

    /**
     * Encodes {@code bytes} as lowercase hex without a prefix.
     *
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            out.append(DIGITS[(b >> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
        }
        return out.toString();
    }

    public static boolean hasPrefix(final CharSequence value) {
        if (value == null || value.length() < 2) {
            return false;
        }
        return value.charAt(0) == '0' && Character.toLowerCase(value.charAt(1)) == 'x';
    }

    /**
     * Returns {@code value} without its {@code 0x} prefix, if it has one.
     *
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    public static String cleanPrefix(final String value) {
        if (value == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(value) ? value.substring(PREFIX.length()) : value;
    }

    /**
     * Whether every character is an ASCII hex digit; true for the empty string.
     */
    public static boolean isHexDigits(final CharSequence digits) {
        return digits.chars().allMatch(c -> nibble((char) c) >= 0);
    }

    private static int digitValue(final char c, final String source) {
        final int value = nibble(c);
        if (value < 0) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' in: " + source);
        }
        return value;
    }

    private static int nibble(final char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
