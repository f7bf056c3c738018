package com.questrail.bridge.observability;

import java.time.Instant;

/**
 * Record of one text frame crossing the transport boundary.
 */
public record BridgeWireEvent(
    Instant timestamp,
    Direction direction,
    String frame
) {
    public enum Direction {
        OUTBOUND,
        INBOUND
    }
}
