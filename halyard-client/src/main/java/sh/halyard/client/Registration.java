// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

/**
 * Handle returned when a listener is registered. Removing twice is harmless.
 *
 * <pre>{@code
 * try (Registration r = client.onMessage(m -> handle(m))) {
 *     ...
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    /** Unregisters the listener. */
    void remove();

    @Override
    default void close() {
        remove();
    }
}
