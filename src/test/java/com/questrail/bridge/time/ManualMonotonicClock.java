package com.questrail.bridge.time;

import com.questrail.bridge.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Test clock that reads zero until a test moves it.
 *
 * <p>Pair with {@link DeterministicScheduler} so timers fire only when the
 * test advances time through the scheduler.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private volatile long nowNanos;

    @Override
    public long nowNanos() {
        return nowNanos;
    }

    public synchronized void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot go backwards: " + delta);
        }
        nowNanos += delta.toNanos();
    }

    public void advanceNanos(long deltaNanos) {
        advance(Duration.ofNanos(deltaNanos));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(nowNanos);
    }
}
