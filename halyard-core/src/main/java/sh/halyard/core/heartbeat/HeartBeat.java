// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.core.heartbeat;

import java.time.Duration;

/**
 * A STOMP heartbeat cadence pair, in milliseconds.
 *
 * <p>On the wire this is the {@code heart-beat} header value {@code "x,y"}. For an
 * advertised cadence, {@code outgoing} is how often the sender can send heartbeats
 * and {@code incoming} how often it wants to receive them. For a negotiated
 * cadence (see {@link #negotiate}) the two values are the intervals this client
 * enforces. Zero disables a direction.
 *
 * <pre>{@code
 * HeartBeat client = HeartBeat.parse("5000,10000");
 * HeartBeat server = HeartBeat.parse("4000,6000");
 * HeartBeat effective = HeartBeat.negotiate(client, server);
 * // effective.outgoing() == 6000, effective.incoming() == 10000
 * }</pre>
 *
 * @param outgoing the outgoing interval in milliseconds, zero when disabled
 * @param incoming the incoming interval in milliseconds, zero when disabled
 * @since 0.1.0
 */
public record HeartBeat(long outgoing, long incoming) {

    /** No heartbeats in either direction: {@code "0,0"}. */
    public static final HeartBeat NONE = new HeartBeat(0, 0);

    public HeartBeat {
        if (outgoing < 0 || incoming < 0) {
            throw new IllegalArgumentException(
                    "heart-beat intervals must be >= 0, got " + outgoing + "," + incoming);
        }
    }

    public static HeartBeat of(final long outgoingMillis, final long incomingMillis) {
        return new HeartBeat(outgoingMillis, incomingMillis);
    }

    public static HeartBeat of(final Duration outgoing, final Duration incoming) {
        return new HeartBeat(outgoing.toMillis(), incoming.toMillis());
    }

    /**
     * Parses a {@code heart-beat} header value.
     *
     * @param value the header value, e.g. {@code "10000,10000"}
     * @throws IllegalArgumentException if the value is not two comma-separated
     *                                  non-negative integers
     */
    public static HeartBeat parse(final String value) {
        int comma = value.indexOf(',');
        if (comma < 0 || value.indexOf(',', comma + 1) >= 0) {
            throw new IllegalArgumentException("heart-beat must be \"<outgoing>,<incoming>\", got: " + value);
        }
        try {
            return new HeartBeat(
                    Long.parseLong(value.substring(0, comma).trim()),
                    Long.parseLong(value.substring(comma + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("heart-beat values must be integers, got: " + value, e);
        }
    }

    /**
     * Computes the intervals this client enforces.
     *
     * <ul>
     *   <li>outgoing: 0 if the client cannot send ({@code cx == 0}) or the server
     *       does not want heartbeats ({@code sy == 0}), else {@code max(cx, sy)}</li>
     *   <li>incoming: 0 if the server cannot send ({@code sx == 0}) or the client
     *       does not want heartbeats ({@code cy == 0}), else {@code max(sx, cy)}</li>
     * </ul>
     *
     * @param client the cadence offered in CONNECT
     * @param server the cadence advertised in CONNECTED
     * @return the effective cadence
     */
    public static HeartBeat negotiate(final HeartBeat client, final HeartBeat server) {
        long out = client.outgoing == 0 || server.incoming == 0 ? 0 : Math.max(client.outgoing, server.incoming);
        long in = server.outgoing == 0 || client.incoming == 0 ? 0 : Math.max(server.outgoing, client.incoming);
        return new HeartBeat(out, in);
    }

    public boolean isDisabled() {
        return outgoing == 0 && incoming == 0;
    }

    /**
     * Returns the {@code heart-beat} header value.
     */
    public String toHeaderValue() {
        return outgoing + "," + incoming;
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
