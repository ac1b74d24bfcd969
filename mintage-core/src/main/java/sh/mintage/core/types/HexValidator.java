// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for validating hex-encoded values of a bounded byte length.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Pattern matching {@code 0x} followed by exactly {@code byteLength * 2} hex digits.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return the compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + byteLength * 2 + "}$");
    }

    /**
     * Pattern matching {@code 0x} followed by 1 to {@code maxBytes * 2} hex digits.
     * <p>
     * Used for the short account form ({@code 0x1}, {@code 0xcafe}) where leading
     * zero digits are omitted.
     *
     * @param maxBytes the largest byte length the value may represent
     * @return the compiled pattern
     */
    public static Pattern upToLength(int maxBytes) {
        return Pattern.compile("^0[xX][0-9a-fA-F]{1," + maxBytes * 2 + "}$");
    }
}
