// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

/**
 * ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY unless {@code FORCE_COLOR=true}
 * is set, in which case every constant is the empty string.
 *
 * <ul>
 * <li><b>TEAL</b> - success, deposits
 * <li><b>CORAL</b> - aborts, burns, withdrawals
 * <li><b>INDIGO</b> - collection and token-type creation
 * <li><b>AMBER</b> - supply changes
 * <li><b>SLATE</b> - metadata and secondary information
 * </ul>
 *
 * @since 0.1.0
 * @see LogFormatter
 */
public final class AnsiColors {

    /** Whether stdout is an interactive terminal (or color is forced). */
    public static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
