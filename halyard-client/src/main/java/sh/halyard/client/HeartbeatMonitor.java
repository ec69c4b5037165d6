// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.halyard.client.transport.ScheduledTask;
import sh.halyard.client.transport.StompReactor;
import sh.halyard.core.heartbeat.HeartBeat;

/**
 * Drives the two heartbeat timers of a connection.
 *
 * <p>Both timers are one-shot and rearmed: the outgoing timer after it fires or
 * a frame is written, the incoming timer whenever bytes arrive. At most one
 * timer of each kind is pending. A zero interval leaves that timer unarmed.
 *
 * <p>Not thread-safe; every method must run on the reactor thread.
 */
final class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    /**
     * What the monitor asks of its owner.
     */
    interface Callbacks {

        /** The outgoing interval elapsed without a write. */
        void sendHeartbeat();

        /** Nothing arrived within the incoming deadline. The monitor has stopped. */
        void onBrokerSilent(long deadlineMillis);
    }

    private final StompReactor reactor;
    private final long marginMillis;
    private final Callbacks callbacks;

    private HeartBeat effective = HeartBeat.NONE;
    private boolean running;
    private @Nullable ScheduledTask outgoingTimer;
    private @Nullable ScheduledTask incomingTimer;

    HeartbeatMonitor(final StompReactor reactor, final long marginMillis, final Callbacks callbacks) {
        this.reactor = Objects.requireNonNull(reactor, "reactor");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        if (marginMillis < 0) {
            throw new IllegalArgumentException("marginMillis must be >= 0, got: " + marginMillis);
        }
        this.marginMillis = marginMillis;
    }

    /**
     * Arms both timers for the negotiated cadence.
     */
    void start(final HeartBeat negotiated) {
        stop();
        this.effective = Objects.requireNonNull(negotiated, "negotiated");
        this.running = true;
        if (!negotiated.isDisabled()) {
            log.debug("Heartbeats armed: send every {} ms, expect data within {} ms",
                    negotiated.outgoing(), incomingDeadlineMillis());
        }
        rearmOutgoing();
        rearmIncoming();
    }

    void onOutboundActivity() {
        if (running) {
            rearmOutgoing();
        }
    }

    void onInboundActivity() {
        if (running) {
            rearmIncoming();
        }
    }

    /**
     * Cancels both timers. Idempotent.
     */
    void stop() {
        running = false;
        outgoingTimer = cancel(outgoingTimer);
        incomingTimer = cancel(incomingTimer);
    }

    boolean isRunning() {
        return running;
    }

    long incomingDeadlineMillis() {
        return effective.incoming() == 0 ? 0 : effective.incoming() + marginMillis;
    }

    private void rearmOutgoing() {
        outgoingTimer = cancel(outgoingTimer);
        if (effective.outgoing() > 0) {
            outgoingTimer = reactor.schedule(this::outgoingExpired, effective.outgoing(), TimeUnit.MILLISECONDS);
        }
    }

    private void rearmIncoming() {
        incomingTimer = cancel(incomingTimer);
        if (effective.incoming() > 0) {
            incomingTimer = reactor.schedule(this::incomingExpired, incomingDeadlineMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void outgoingExpired() {
        if (!running) {
            return;
        }
        outgoingTimer = null;
        callbacks.sendHeartbeat();
        if (running) {
            rearmOutgoing();
        }
    }

    private void incomingExpired() {
        if (!running) {
            return;
        }
        incomingTimer = null;
        long deadline = incomingDeadlineMillis();
        stop();
        callbacks.onBrokerSilent(deadline);
    }

    private static @Nullable ScheduledTask cancel(final @Nullable ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
        return null;
    }
}
