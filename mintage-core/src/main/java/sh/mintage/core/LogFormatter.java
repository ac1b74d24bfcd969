// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import static sh.mintage.core.AnsiColors.*;

import sh.mintage.core.types.Address;

/**
 * Log line formatter for ledger operations.
 *
 * <p>
 * Every line starts with a bracketed operation tag. Status symbols (✓ ✗) mark
 * outcomes, never operation types. Addresses are shortened: short-form
 * addresses ({@code 0xcafe}) print as-is, long ones as {@code 0x1234...abcd}.
 *
 * <pre>{@code
 * DebugLogger.logLedger(LogFormatter.formatMint(authorizer, destination, "0xc::Sets::A", 5, 5L));
 * // Output: [MINT] by=0xc to=0xc token=0xc::Sets::A amount=5 supply=5
 * }</pre>
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int ADDRESS_PREFIX_LENGTH = 6;

    private static final int ADDRESS_SUFFIX_LENGTH = 4;

    private static final int ADDRESS_SHORTEN_THRESHOLD = ADDRESS_PREFIX_LENGTH + ADDRESS_SUFFIX_LENGTH + 3;

    private LogFormatter() {
    }

    /**
     * Format: [COLLECTION] creator=0xc name=Sets maximum=2
     */
    public static String formatCollection(Address creator, String name, Long maximum) {
        return String.format(
                "%s[COLLECTION]%s creator=%s name=%s maximum=%s",
                INDIGO, RESET,
                shorten(creator), name, limit(maximum));
    }

    /**
     * Format: [TOKEN-TYPE] token=0xc::Sets::A maximum=1 tracked=true initial=1
     */
    public static String formatTokenType(String identity, Long maximum, boolean tracked, long initialAmount) {
        return String.format(
                "%s[TOKEN-TYPE]%s token=%s maximum=%s tracked=%s initial=%d",
                INDIGO, RESET,
                identity, limit(maximum), tracked, initialAmount);
    }

    /**
     * Format: [MINT] by=0xc to=0xb token=0xc::Sets::A amount=5 supply=5
     */
    public static String formatMint(Address authorizer, Address destination, String identity, long amount, Long supply) {
        return String.format(
                "%s[MINT]%s by=%s to=%s token=%s amount=%d supply=%s",
                AMBER, RESET,
                shorten(authorizer), shorten(destination), identity, amount, supply(supply));
    }

    /**
     * Format: [BURN] owner=0xb token=0xc::Sets::A amount=2 supply=3
     */
    public static String formatBurn(Address owner, String identity, long amount, Long supply) {
        return String.format(
                "%s[BURN]%s owner=%s token=%s amount=%d supply=%s",
                CORAL, RESET,
                shorten(owner), identity, amount, supply(supply));
    }

    /**
     * Format: [DEPOSIT] account=0xb token=0xc::Sets::A amount=2
     */
    public static String formatDeposit(Address account, String identity, long amount) {
        return String.format(
                "%s[DEPOSIT]%s account=%s token=%s amount=%d",
                TEAL, RESET,
                shorten(account), identity, amount);
    }

    /**
     * Format: [WITHDRAW] account=0xc token=0xc::Sets::A amount=2
     */
    public static String formatWithdraw(Address account, String identity, long amount) {
        return String.format(
                "%s[WITHDRAW]%s account=%s token=%s amount=%d",
                CORAL, RESET,
                shorten(account), identity, amount);
    }

    /**
     * Format: [EVENT] key=0xc#2 seq=0 type=Deposited
     */
    public static String formatEvent(String key, long sequenceNumber, String type) {
        return String.format(
                "%s[EVENT]%s key=%s seq=%d type=%s",
                SLATE, RESET,
                key, sequenceNumber, type);
    }

    /**
     * Format: ✓ [COMMIT] tx=directTransfer events=2
     */
    public static String formatCommit(String transaction, int events) {
        return String.format(
                "%s✓%s %s[COMMIT]%s tx=%s events=%d",
                TEAL, RESET,
                TEAL, RESET,
                transaction, events);
    }

    /**
     * Format: ✗ [ABORT] tx=mintTo code=MINT_LIMIT_EXCEEDED reason=...
     */
    public static String formatAbort(String transaction, String code, String reason) {
        return String.format(
                "%s✗%s %s[ABORT]%s tx=%s code=%s reason=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                transaction,
                code,
                CORAL, reason, RESET);
    }

    /**
     * Shortens an address for display: the short form when it fits, otherwise
     * {@code 0xabcd...ef12}.
     *
     * @param address the address, may be null
     * @return display text, "null" for null
     */
    public static String shorten(Address address) {
        if (address == null) {
            return "null";
        }
        final String compact = address.toShortString();
        if (compact.length() <= ADDRESS_SHORTEN_THRESHOLD) {
            return compact;
        }
        return compact.substring(0, ADDRESS_PREFIX_LENGTH)
                + "..."
                + compact.substring(compact.length() - ADDRESS_SUFFIX_LENGTH);
    }

    private static String limit(Long maximum) {
        return maximum == null ? "unlimited" : maximum.toString();
    }

    private static String supply(Long supply) {
        return supply == null ? "untracked" : supply.toString();
    }
}
