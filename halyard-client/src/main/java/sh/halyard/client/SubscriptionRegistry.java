// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

import org.jspecify.annotations.Nullable;

/**
 * Destinations this connection subscribed to, keyed by destination.
 *
 * <p>Not thread-safe; owned by the client's reactor thread.
 */
final class SubscriptionRegistry {

    private static final int ID_RANGE = 1_000_000;

    private final Map<String, Subscription> byDestination = new LinkedHashMap<>();
    private final Random random;

    SubscriptionRegistry(final Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Nullable Subscription find(final String destination) {
        return byDestination.get(destination);
    }

    boolean containsId(final String id) {
        for (Subscription s : byDestination.values()) {
            if (s.id().equals(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Records a subscription for a destination not tracked yet.
     *
     * @param id the caller's id, or null to generate one
     * @throws IllegalStateException    if the destination is already tracked
     * @throws IllegalArgumentException if the id is in use by another destination
     */
    Subscription register(final String destination, final AckMode ackMode, final @Nullable String id) {
        if (byDestination.containsKey(destination)) {
            throw new IllegalStateException("Already subscribed to " + destination);
        }
        String subscriptionId = id;
        if (subscriptionId == null) {
            subscriptionId = nextId();
        } else if (containsId(subscriptionId)) {
            throw new IllegalArgumentException("Subscription id already in use: " + subscriptionId);
        }
        Subscription subscription = new Subscription(subscriptionId, destination, ackMode);
        byDestination.put(destination, subscription);
        return subscription;
    }

    /**
     * Forgets the subscription with the given id, if any.
     */
    Optional<Subscription> removeById(final String id) {
        Iterator<Subscription> it = byDestination.values().iterator();
        while (it.hasNext()) {
            Subscription s = it.next();
            if (s.id().equals(id)) {
                it.remove();
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a random id not used by a tracked subscription.
     */
    String nextId() {
        String id;
        do {
            id = Integer.toString(random.nextInt(ID_RANGE));
        } while (containsId(id));
        return id;
    }

    List<Subscription> snapshot() {
        return List.copyOf(byDestination.values());
    }

    int size() {
        return byDestination.size();
    }

    void clear() {
        byDestination.clear();
    }
}
