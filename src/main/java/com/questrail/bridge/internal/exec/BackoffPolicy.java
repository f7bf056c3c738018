package com.questrail.bridge.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * BackoffPolicy
 * -----------------------------------------------------------------------------
 * Reconnection spacing and cap.
 *
 * <pre>
 *   delay(attempt) = min(initialDelay * multiplier^attempt, maxDelay)
 * </pre>
 *
 * <p>Attempts are zero-based: with the defaults the first retry waits 1000ms,
 * then 2000, 4000, 8000, 16000, and any later attempt is held at 30000ms.
 * {@link #maxAttempts()} bounds how many automatic retries are scheduled
 * before the connection is declared failed.</p>
 *
 * <p>Pure data: the policy decides <em>how long</em>, the connection manager
 * decides <em>whether</em>.</p>
 */
public record BackoffPolicy(
        Duration initialDelay,
        double multiplier,
        Duration maxDelay,
        int maxAttempts
) {
    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1.0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative");
        }
    }

    /**
     * Defaults: 1000ms initial delay, 2x multiplier, 30000ms cap, 5 attempts.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofMillis(1000), 2.0, Duration.ofMillis(30_000), 5);
    }

    /**
     * Delay before the given zero-based retry attempt.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative");
        }

        double scaled = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        long maxMillis = maxDelay.toMillis();
        if (Double.isNaN(scaled) || scaled >= maxMillis) {
            return maxDelay;
        }
        return Duration.ofMillis((long) scaled);
    }
}
