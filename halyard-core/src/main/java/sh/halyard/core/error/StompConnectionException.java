// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.error;

/**
 * Thrown for transport-level failures and for frame operations attempted on a
 * client that is not connected.
 *
 * @since 0.1.0
 */
public final class StompConnectionException extends HalyardException {

    public StompConnectionException(final String message) {
        super(message);
    }

    public StompConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * An operation that writes a frame was called outside the CONNECTED state.
     */
    public static StompConnectionException notConnected(final String operation, final Object state) {
        return new StompConnectionException(
                "Cannot " + operation + ": client is " + state + ", not CONNECTED");
    }
}
