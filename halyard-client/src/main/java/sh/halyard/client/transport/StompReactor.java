// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * The single thread that owns a connection's state.
 *
 * <p>Transport callbacks and timer expiries run on this thread. Client
 * operations invoked from other threads are handed over with {@link #execute}.
 */
public interface StompReactor extends Executor {

    /**
     * Returns true if the calling thread is the reactor thread.
     */
    boolean inEventLoop();

    /**
     * Runs a task once after the given delay, on the reactor thread.
     *
     * @return a handle that cancels the task
     */
    ScheduledTask schedule(Runnable task, long delay, TimeUnit unit);
}
