package com.questrail.bridge.observability;

/**
 * Receives bridge client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called after every connection state change.
     * @param event the transition details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called for every frame written to or read from the transport.
     * @param event the frame details
     */
    void onWireEvent(BridgeWireEvent event);

    /**
     * Called when something goes wrong that no single caller owns: undecodable
     * frames, failing listeners, transport errors, exhausted retries.
     * @param event the error details
     */
    void onError(BridgeErrorEvent event);
}
