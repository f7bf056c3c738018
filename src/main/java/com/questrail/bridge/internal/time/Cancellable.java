package com.questrail.bridge.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task scheduled on a {@link MonotonicScheduler}.
 *
 * <p>Every timer in the bridge client (request timeouts, the connect timeout,
 * reconnection backoff) is held through one of these so that the component
 * that armed it can clear it on settle or teardown.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was already cancelled
     */
    boolean cancel();
}
