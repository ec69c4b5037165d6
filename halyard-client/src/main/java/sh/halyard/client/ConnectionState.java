// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

/**
 * Lifecycle of a {@link StompClient}. Transitions only move forward;
 * {@link #DISCONNECTED} is terminal.
 */
public enum ConnectionState {
    /** Created, {@code connect} not called yet. */
    UNCONNECTED,
    /** Transport connecting or CONNECT sent, waiting for CONNECTED. */
    CONNECTING,
    /** CONNECTED received; frames may be sent. */
    CONNECTED,
    /** Torn down. A new client is needed to connect again. */
    DISCONNECTED
}
