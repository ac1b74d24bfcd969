// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug output for ledger operations and emitted events, gated by
 * {@link MintageDebug}.
 *
 * <p>
 * Lines go to stdout when attached to a terminal (keeping colors) and to the
 * SLF4J logger {@code sh.mintage.debug} at INFO otherwise. Arguments, when given,
 * are applied with {@link String#formatted}; pass preformatted text for lines
 * that embed user strings containing {@code %}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.mintage.debug");

    private DebugLogger() {
    }

    /** Collection, token type, mint, burn, deposit, withdraw, commit and abort lines. */
    public static void logLedger(final String message, final Object... args) {
        write(MintageDebug.isLedgerLoggingEnabled(), message, args);
    }

    /** One line per event record of a committed transaction. */
    public static void logEvent(final String message, final Object... args) {
        write(MintageDebug.isEventLoggingEnabled(), message, args);
    }

    public static void log(final String message, final Object... args) {
        write(MintageDebug.isEnabled(), message, args);
    }

    private static void write(final boolean enabled, final String message, final Object... args) {
        if (!enabled) {
            return;
        }
        final String line = LogSanitizer.sanitize(args == null || args.length == 0 ? message : message.formatted(args));
        if (AnsiColors.IS_TTY) {
            System.out.println(line);
        } else {
            LOG.info(line);
        }
    }
}
