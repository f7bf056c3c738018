package com.questrail.bridge.error;

/**
 * The transport failed to open, closed unexpectedly, or was closed by
 * {@code disconnect()} while requests were outstanding.
 */
public final class BridgeConnectionException extends BridgeException
{
    public BridgeConnectionException(String message) {
        super(message);
    }

    public BridgeConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
