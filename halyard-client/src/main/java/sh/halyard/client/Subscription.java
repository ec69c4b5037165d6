// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.util.Objects;

/**
 * A subscription recorded by the client.
 *
 * @param id          the subscription id, unique within the connection
 * @param destination the subscribed destination
 * @param ackMode     the acknowledgment mode requested
 */
public record Subscription(String id, String destination, AckMode ackMode) {

    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(ackMode, "ackMode");
    }
}
