package com.questrail.bridge.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used only to stamp observability events.
 */
public interface WallClock
{
    Instant now();
}
