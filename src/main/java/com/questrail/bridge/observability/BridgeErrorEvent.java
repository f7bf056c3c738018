package com.questrail.bridge.observability;

import java.time.Instant;

/**
 * Record of an error or anomaly in the bridge client.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
