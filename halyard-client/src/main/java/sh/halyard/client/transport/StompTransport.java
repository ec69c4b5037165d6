// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

/**
 * Bidirectional byte stream to a broker.
 *
 * <p>Implementations never block: {@link #connect} reports its outcome through
 * the listener, and {@link #write} queues bytes. Writes after the stream closed
 * are dropped without error.
 */
public interface StompTransport {

    /**
     * Returns the reactor that runs this transport's callbacks.
     */
    StompReactor reactor();

    /**
     * Starts connecting. Exactly one of {@link TransportListener#onConnected()} or
     * {@link TransportListener#onConnectFailed(Throwable)} follows.
     */
    void connect(String host, int port, TransportListener listener);

    /**
     * Queues bytes for writing, preserving call order.
     */
    void write(byte[] data);

    /**
     * Flushes queued writes, closes the stream and releases the resources this
     * transport owns. Idempotent. No listener callback follows a local close.
     */
    void close();
}
