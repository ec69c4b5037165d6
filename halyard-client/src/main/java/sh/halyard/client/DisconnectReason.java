// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

/**
 * Why a connection ended.
 */
public enum DisconnectReason {
    /** {@link StompClient#disconnect()} or {@link StompClient#close()} was called. */
    CLIENT_DISCONNECT,
    /** The transport could not connect. */
    CONNECT_FAILED,
    /** The transport failed or the broker closed the stream. */
    TRANSPORT_ERROR,
    /** Nothing arrived from the broker within the negotiated interval plus margin. */
    HEARTBEAT_TIMEOUT
}
