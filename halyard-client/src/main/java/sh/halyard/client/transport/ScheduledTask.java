// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.halyard.client.transport;

/**
 * Handle to a task scheduled on a {@link StompReactor}.
 */
@FunctionalInterface
public interface ScheduledTask {

    /**
     * Cancels the task if it has not run yet. Cancelling twice, or after the task
     * ran, has no effect.
     */
    void cancel();
}
