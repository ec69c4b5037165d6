// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

import io.netty.buffer.ByteBuf;

/**
 * Callbacks from a {@link StompTransport}. All methods are invoked on the
 * transport's reactor thread.
 */
public interface TransportListener {

    /** The byte stream is established and writable. */
    void onConnected();

    /** The connection attempt failed. No other callback follows. */
    void onConnectFailed(Throwable cause);

    /**
     * Bytes arrived. The buffer is only valid for the duration of the call;
     * implementations must copy what they keep.
     */
    void onRead(ByteBuf data);

    /** An I/O error occurred or the peer closed the stream. */
    void onError(Throwable cause);
}
