package com.questrail.bridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for every timing decision in the client.
 *
 * <p>Timeouts and backoff delays are measured against this clock only.
 * Wall-clock time is used for observability timestamps and nothing else.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
