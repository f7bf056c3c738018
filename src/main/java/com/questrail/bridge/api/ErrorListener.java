package com.questrail.bridge.api;

import com.questrail.bridge.error.BridgeException;

/**
 * Receives connection-level failures that belong to no single request:
 * {@link com.questrail.bridge.error.BridgeConnectionException} and
 * {@link com.questrail.bridge.error.ExhaustedRetriesException}.
 */
@FunctionalInterface
public interface ErrorListener
{
    void onError(BridgeException error);
}
