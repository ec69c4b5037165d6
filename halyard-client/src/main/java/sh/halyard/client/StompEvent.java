// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.halyard.core.error.StompDecodingException;
import sh.halyard.core.frame.StompCommand;
import sh.halyard.core.frame.StompHeaders;

/**
 * Events published by a {@link StompClient}. Each type carries its own payload;
 * listeners subscribe per type.
 *
 * <p>Byte arrays in events are owned by the event and are not copied for each
 * listener; listeners should not modify them.
 */
public sealed interface StompEvent {

    /**
     * A frame was written. Heartbeats are not reported.
     *
     * @param command the frame command
     * @param raw     the encoded frame, including the trailing NUL
     */
    record FrameSent(StompCommand command, byte[] raw) implements StompEvent {
        public FrameSent {
            Objects.requireNonNull(command, "command");
            Objects.requireNonNull(raw, "raw");
        }

        public String rawAsString() {
            return new String(raw, StandardCharsets.UTF_8);
        }
    }

    /**
     * The broker accepted the connection.
     *
     * @param headers the CONNECTED headers, unescaped as received
     */
    record Connected(StompHeaders headers) implements StompEvent {
        public Connected {
            Objects.requireNonNull(headers, "headers");
        }

        public @Nullable String session() {
            return headers.get(StompHeaders.SESSION);
        }

        public @Nullable String version() {
            return headers.get(StompHeaders.VERSION);
        }

        public @Nullable String server() {
            return headers.get(StompHeaders.SERVER);
        }
    }

    /**
     * A MESSAGE frame arrived.
     */
    record MessageReceived(StompHeaders headers, byte[] body) implements StompEvent {
        public MessageReceived {
            Objects.requireNonNull(headers, "headers");
            Objects.requireNonNull(body, "body");
        }

        public @Nullable String destination() {
            return headers.get(StompHeaders.DESTINATION);
        }

        public @Nullable String messageId() {
            return headers.get(StompHeaders.MESSAGE_ID);
        }

        public @Nullable String subscription() {
            return headers.get(StompHeaders.SUBSCRIPTION);
        }

        /**
         * Returns the value to pass to {@link StompClient#ack} or {@link StompClient#nack}:
         * the {@code ack} header, else the {@code message-id}.
         */
        public @Nullable String ackId() {
            String ack = headers.get(StompHeaders.ACK);
            return ack != null ? ack : messageId();
        }

        public String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    /**
     * A RECEIPT frame arrived.
     */
    record ReceiptReceived(StompHeaders headers) implements StompEvent {
        public ReceiptReceived {
            Objects.requireNonNull(headers, "headers");
        }

        public @Nullable String receiptId() {
            return headers.get(StompHeaders.RECEIPT_ID);
        }
    }

    /**
     * The broker sent an ERROR frame.
     */
    record BrokerError(StompHeaders headers, byte[] body) implements StompEvent {
        public BrokerError {
            Objects.requireNonNull(headers, "headers");
            Objects.requireNonNull(body, "body");
        }

        /** The short description in the {@code message} header. */
        public @Nullable String message() {
            return headers.get(StompHeaders.MESSAGE);
        }

        public String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    /**
     * The connection ended. Published exactly once per client.
     *
     * @param reason why the connection ended
     * @param cause  the underlying failure, null for a client disconnect
     */
    record Disconnected(DisconnectReason reason, @Nullable Throwable cause) implements StompEvent {
        public Disconnected {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * An inbound frame was dropped as malformed. The connection stays up.
     */
    record DecodeFailed(StompDecodingException error) implements StompEvent {
        public DecodeFailed {
            Objects.requireNonNull(error, "error");
        }
    }
}
