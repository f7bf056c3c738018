package com.questrail.bridge.routing;

import com.questrail.bridge.protocol.UnroutableMessage;

/**
 * Receives inbound messages whose type names no known message kind.
 */
@FunctionalInterface
public interface UnroutedListener
{
    void onUnrouted(UnroutableMessage message);
}
