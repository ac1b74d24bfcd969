// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import java.util.regex.Pattern;

/**
 * Cleans debug log lines that embed caller-supplied strings.
 *
 * <p>
 * Collection names, token names, descriptions and URIs come straight from
 * transaction arguments. Sanitization:
 * <ul>
 * <li>replaces CR/LF so a name cannot forge extra log lines</li>
 * <li>drops escape sequences other than the SGR color codes this library emits</li>
 * <li>truncates excessively long lines</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    /** ESC not followed by an SGR sequence ("[...m"), or other C0 control characters. */
    private static final Pattern FOREIGN_CONTROL =
            Pattern.compile("\u001B(?!\\[[0-9;]*m)|[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1A\\x1C-\\x1F\\x7F]");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = LINE_BREAKS.matcher(input).replaceAll(" ");
        sanitized = FOREIGN_CONTROL.matcher(sanitized).replaceAll("");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }
}
