package com.questrail.bridge.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnection attempt tracker.
 *
 * - Counts consecutive retries since the last successful open
 * - Resets on open and on an explicit connect
 * - Delegates spacing to {@link BackoffPolicy}
 *
 * Not thread-safe; the connection manager only touches it under its lock.
 */
public final class ReconnectAttemptTracker {

    private final BackoffPolicy policy;
    private int attempts;

    public ReconnectAttemptTracker(BackoffPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Whether the retry budget is spent.
     */
    public boolean exhausted() {
        return attempts >= policy.maxAttempts();
    }

    /**
     * Record that a retry is being scheduled.
     *
     * @return delay to wait before that retry
     * @throws IllegalStateException if the budget is already spent
     */
    public Duration recordAttempt() {
        if (exhausted()) {
            throw new IllegalStateException("Reconnection attempts exhausted");
        }
        Duration delay = policy.delay(attempts);
        attempts++;
        return delay;
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }

    public ReconnectionState snapshot() {
        return new ReconnectionState(
                attempts,
                policy.maxAttempts(),
                policy.delay(attempts),
                policy.maxDelay()
        );
    }
}
