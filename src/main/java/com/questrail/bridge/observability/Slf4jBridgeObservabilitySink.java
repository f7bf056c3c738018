package com.questrail.bridge.observability;

import com.questrail.bridge.api.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Wire frames go to a separate {@code com.questrail.bridge.WIRE} logger at
 * DEBUG so they can be enabled independently.</p>
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);
    private static final Logger wire = LoggerFactory.getLogger("com.questrail.bridge.WIRE");

    private static final int MAX_FRAME_CHARS = 200;

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        if (!event.isChange()) {
            return;
        }

        if (event.newState() == ConnectionState.RECONNECTING) {
            log.info("Bridge connection: {} -> {} ({}), attempt {}/{}",
                event.oldState(),
                event.newState(),
                event.reason(),
                event.reconnection().attemptCount(),
                event.reconnection().maxAttempts());
        } else {
            log.info("Bridge connection: {} -> {} ({})",
                event.oldState(),
                event.newState(),
                event.reason());
        }
    }

    @Override
    public void onWireEvent(BridgeWireEvent event) {
        if (wire.isDebugEnabled()) {
            wire.debug("{} {}",
                event.direction() == BridgeWireEvent.Direction.OUTBOUND ? "TX" : "RX",
                truncate(event.frame()));
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        if (event.cause() == null) {
            log.warn("Bridge: {}", event.message());
        } else {
            log.error("Bridge error: {}", event.message(), event.cause());
        }
    }

    static String truncate(String frame) {
        if (frame == null || frame.length() <= MAX_FRAME_CHARS) {
            return frame;
        }
        return frame.substring(0, MAX_FRAME_CHARS) + "...";
    }
}
