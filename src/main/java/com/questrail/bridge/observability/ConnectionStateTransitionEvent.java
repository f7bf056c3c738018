package com.questrail.bridge.observability;

import com.questrail.bridge.api.ConnectionState;
import com.questrail.bridge.internal.exec.ReconnectionState;

import java.time.Instant;

/**
 * Record of one connection state change.
 *
 * @param reason short human-readable trigger, e.g. {@code "transport closed"}
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    ReconnectionState reconnection,
    String reason
) {
    public boolean isChange() {
        return oldState != newState;
    }
}
