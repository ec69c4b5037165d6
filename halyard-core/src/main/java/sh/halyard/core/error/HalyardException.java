// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.error;

/**
 * Base runtime exception for all Halyard failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * HalyardException
 * ├── {@link StompDecodingException} - a received frame violates the STOMP 1.2 grammar
 * └── {@link StompConnectionException} - transport failures and operations on a closed client
 * </pre>
 *
 * <p>
 * Broker ERROR frames are not exceptions: they are delivered to the application
 * as regular events.
 *
 * @since 0.1.0
 */
public sealed class HalyardException extends RuntimeException
        permits StompDecodingException, StompConnectionException {

    public HalyardException(final String message) {
        super(message);
    }

    public HalyardException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
