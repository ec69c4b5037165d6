// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans events out to the listeners registered for their type.
 *
 * <p>Listeners run synchronously on the dispatching thread, in registration
 * order. A listener that throws is logged and reported to metrics; the
 * remaining listeners still run. Registration is safe from any thread.
 */
public final class StompEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StompEventDispatcher.class);

    private final Map<Class<? extends StompEvent>, List<Consumer<StompEvent>>> listeners = new ConcurrentHashMap<>();
    private volatile StompMetrics metrics = StompMetrics.noop();

    /**
     * Registers a listener for one event type.
     */
    public <E extends StompEvent> Registration register(final Class<E> type, final Consumer<? super E> listener) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        Consumer<StompEvent> adapter = event -> listener.accept(type.cast(event));
        List<Consumer<StompEvent>> list = listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        list.add(adapter);
        return () -> list.remove(adapter);
    }

    /**
     * Delivers an event to every listener registered for its type.
     */
    public void dispatch(final StompEvent event) {
        List<Consumer<StompEvent>> list = listeners.get(event.getClass());
        if (list == null) {
            return;
        }
        for (Consumer<StompEvent> listener : list) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Listener for {} threw", event.getClass().getSimpleName(), e);
                metrics.onListenerError(event.getClass(), e);
            }
        }
    }

    public int listenerCount(final Class<? extends StompEvent> type) {
        List<Consumer<StompEvent>> list = listeners.get(type);
        return list == null ? 0 : list.size();
    }

    void setMetrics(final StompMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }
}
