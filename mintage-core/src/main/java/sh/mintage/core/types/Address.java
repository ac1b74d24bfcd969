// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.mintage.primitives.Hex;

/**
 * Hex-encoded 32-byte account address.
 * <p>
 * Every ledger resource (collection registry, holder inventory) is addressed by
 * the account that owns it.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase. Use {@link #parse(String)} to accept the
 * short form with leading zeros omitted.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final int HEX_LENGTH = BYTE_LENGTH * 2;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);
    private static final Pattern SHORT_HEX = HexValidator.upToLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0}).
     */
    public static final Address ZERO = new Address("0x" + "0".repeat(HEX_LENGTH));

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the full or the short address form.
     * <p>
     * {@code 0x1} and {@code 0x0000...0001} denote the same account.
     *
     * @param text the address text, {@code 0x}-prefixed
     * @return the address
     * @throws NullPointerException     if text is null
     * @throws IllegalArgumentException if text is not 1-64 hex digits after the prefix
     */
    public static Address parse(final String text) {
        Objects.requireNonNull(text, "address");
        if (!SHORT_HEX.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid address: " + text);
        }
        final String digits = Hex.cleanPrefix(text);
        return new Address("0x" + "0".repeat(HEX_LENGTH - digits.length()) + digits);
    }

    /**
     * Decodes this address to a 32-byte array.
     *
     * @return 32-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    /**
     * Renders the address with leading zero digits removed, e.g. {@code 0xcafe}.
     */
    public String toShortString() {
        int i = 2;
        while (i < value.length() - 1 && value.charAt(i) == '0') {
            i++;
        }
        return "0x" + value.substring(i);
    }

    @Override
    public String toString() {
        return value;
    }
}
