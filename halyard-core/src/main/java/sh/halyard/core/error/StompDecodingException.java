// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when an inbound frame cannot be decoded.
 *
 * <p>A decoding failure is fatal for the offending frame only. The decoder drops
 * the frame and resumes with the next one.
 *
 * @since 0.1.0
 */
public final class StompDecodingException extends HalyardException {

    private final @Nullable String command;

    public StompDecodingException(final String message) {
        this(message, null);
    }

    public StompDecodingException(final String message, final @Nullable String command) {
        super(command == null ? message : message + " (frame " + command + ")");
        this.command = command;
    }

    /**
     * Returns the command of the frame being decoded, if it was known when the
     * error occurred.
     */
    public @Nullable String command() {
        return command;
    }

    /**
     * An escape sequence other than {@code \\}, {@code \r}, {@code \n} or {@code \c}.
     */
    public static StompDecodingException invalidEscape(final String text, final int index) {
        final String sequence = index + 1 < text.length() ? text.substring(index, index + 2) : "\\";
        return new StompDecodingException(
                "Invalid escape sequence '%s' at index %d".formatted(sequence, index));
    }

    /**
     * A {@code content-length} header that is not a non-negative integer.
     */
    public static StompDecodingException invalidContentLength(final String value, final String command) {
        return new StompDecodingException("Invalid content-length '" + value + "'", command);
    }

    /**
     * A {@code content-length} delimited body that is not followed by the NUL terminator.
     */
    public static StompDecodingException missingTerminator(final String command) {
        return new StompDecodingException("Body not followed by NUL terminator", command);
    }

    /**
     * Returns a copy of this exception carrying the frame command.
     */
    public StompDecodingException withCommand(final String frameCommand) {
        StompDecodingException copy = new StompDecodingException(getMessage(), frameCommand);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
