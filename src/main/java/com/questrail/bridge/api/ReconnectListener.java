package com.questrail.bridge.api;

/**
 * Notified each time an automatic reconnection succeeds. Not called for the
 * first successful {@code connect()}.
 */
@FunctionalInterface
public interface ReconnectListener
{
    void onReconnected();
}
