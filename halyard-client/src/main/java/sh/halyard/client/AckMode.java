// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

/**
 * Acknowledgment modes of a subscription, sent as the SUBSCRIBE {@code ack} header.
 */
public enum AckMode {
    /** The broker considers a message acknowledged once sent. */
    AUTO("auto"),
    /** An ACK acknowledges the message and every earlier one on the subscription. */
    CLIENT("client"),
    /** An ACK acknowledges that message only. */
    CLIENT_INDIVIDUAL("client-individual");

    private final String headerValue;

    AckMode(final String headerValue) {
        this.headerValue = headerValue;
    }

    public String headerValue() {
        return headerValue;
    }

    /**
     * Looks up a mode by its header value.
     *
     * @throws IllegalArgumentException if the value is not a STOMP ack mode
     */
    public static AckMode fromHeaderValue(final String value) {
        for (AckMode mode : values()) {
            if (mode.headerValue.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown ack mode: " + value);
    }
}
