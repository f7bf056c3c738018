package com.questrail.bridge.internal.exec;

import java.time.Duration;

/**
 * Snapshot of reconnection progress, published with state transitions.
 *
 * @param attemptCount retries scheduled since the last successful open
 * @param maxAttempts  retry cap from the {@link BackoffPolicy}
 * @param currentDelay delay the next retry would wait
 * @param maxDelay     delay cap from the {@link BackoffPolicy}
 */
public record ReconnectionState(
        int attemptCount,
        int maxAttempts,
        Duration currentDelay,
        Duration maxDelay
) {
    public boolean exhausted() {
        return attemptCount >= maxAttempts;
    }
}
