// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.frame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single STOMP frame: command, headers and an optional body.
 *
 * <p>The body is never null; frames without a body carry an empty array.
 * The array is not copied, so callers must not modify it after construction.
 *
 * @param command the frame command
 * @param headers the frame headers
 * @param body    the frame body, empty when absent
 */
public record StompFrame(StompCommand command, StompHeaders headers, byte[] body) {

    private static final byte[] NO_BODY = new byte[0];

    public StompFrame {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(headers, "headers");
        if (body == null) {
            body = NO_BODY;
        }
    }

    /**
     * Creates a frame without a body.
     */
    public static StompFrame of(final StompCommand command, final StompHeaders headers) {
        return new StompFrame(command, headers, NO_BODY);
    }

    /**
     * Decodes the body as UTF-8 text.
     */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof StompFrame other
                && command == other.command
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(command, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "StompFrame[command=" + command + ", headers=" + headers + ", body=" + body.length + " bytes]";
    }
}
