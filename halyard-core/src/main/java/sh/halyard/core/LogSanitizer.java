// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core;

import java.util.regex.Pattern;

/**
 * Makes frame dumps safe and readable for logs.
 *
 * <ul>
 * <li>Redacts {@code passcode} header values so credentials never reach a log</li>
 * <li>Renders NUL as {@code ^@} and line feeds as {@code \n}</li>
 * <li>Truncates long dumps</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length of sanitized output, suffix included. */
    static final int MAX_LOG_LENGTH = 2000;

    static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches a passcode header line up to its line terminator. */
    private static final Pattern PASSCODE_PATTERN = Pattern.compile("(?m)^passcode:[^\\r\\n]*");

    private static final String PASSCODE_REPLACEMENT = "passcode:***[REDACTED]***";

    private LogSanitizer() {
    }

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("passcode:")) {
            sanitized = PASSCODE_PATTERN.matcher(sanitized).replaceAll(PASSCODE_REPLACEMENT);
        }

        sanitized = sanitized.replace("\0", "^@").replace("\r", "\\r").replace("\n", "\\n");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
