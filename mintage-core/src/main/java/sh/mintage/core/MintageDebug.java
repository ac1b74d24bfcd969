// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

/**
 * Global toggle for verbose debug logging of ledger operations and events.
 */
public final class MintageDebug {

    private static volatile boolean ledgerLogging = false;
    private static volatile boolean eventLogging = false;

    private MintageDebug() {
    }

    public static boolean isEnabled() {
        return ledgerLogging || eventLogging;
    }

    public static void setEnabled(final boolean enabled) {
        ledgerLogging = enabled;
        eventLogging = enabled;
    }

    public static void setLedgerLogging(final boolean enabled) {
        ledgerLogging = enabled;
    }

    public static boolean isLedgerLoggingEnabled() {
        return ledgerLogging;
    }

    public static void setEventLogging(final boolean enabled) {
        eventLogging = enabled;
    }

    public static boolean isEventLoggingEnabled() {
        return eventLogging;
    }
}
