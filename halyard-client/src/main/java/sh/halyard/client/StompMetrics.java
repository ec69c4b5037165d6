// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import sh.halyard.core.error.StompDecodingException;
import sh.halyard.core.frame.StompCommand;

/**
 * Interface for collecting metrics from a {@link StompClient}.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other monitoring
 * library. By default, a no-op implementation is used ({@link #noop()}).
 *
 * <pre>{@code
 * StompClient client = StompClient.create(config);
 * client.setMetrics(new MyMicrometerMetrics(meterRegistry));
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> methods are called from the client's reactor
 * thread. Implementations shared between clients must be thread-safe.
 */
public interface StompMetrics {

    /**
     * Called after a frame was handed to the transport.
     *
     * @param command the frame command
     */
    default void onFrameSent(StompCommand command) {
    }

    /**
     * Called when a complete frame was decoded.
     *
     * @param command the frame command
     */
    default void onFrameReceived(StompCommand command) {
    }

    /** Called when a heartbeat was written. */
    default void onHeartbeatSent() {
    }

    /** Called when a heartbeat arrived. */
    default void onHeartbeatReceived() {
    }

    /** Called when the broker stayed silent past the incoming heartbeat deadline. */
    default void onHeartbeatTimeout() {
    }

    /**
     * Called when an inbound frame was dropped as malformed.
     *
     * @param error the decoding failure
     */
    default void onDecodeError(StompDecodingException error) {
    }

    /**
     * Called once per client when the connection ends.
     *
     * @param reason why the connection ended
     */
    default void onDisconnected(DisconnectReason reason) {
    }

    /**
     * Called when an event listener threw.
     *
     * @param eventType the event being delivered
     * @param error     the exception thrown by the listener
     */
    default void onListenerError(Class<? extends StompEvent> eventType, Throwable error) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     */
    static StompMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of StompMetrics.
 */
enum NoopMetrics implements StompMetrics {
    INSTANCE
}
