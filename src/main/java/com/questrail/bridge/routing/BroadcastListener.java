package com.questrail.bridge.routing;

import com.questrail.bridge.protocol.BridgeBroadcast;

/**
 * Receives unsolicited messages of the kind it subscribed to.
 *
 * <p>Called on the transport thread. Implementations should hand long work
 * off rather than block delivery to other listeners.</p>
 */
@FunctionalInterface
public interface BroadcastListener
{
    void onBroadcast(BridgeBroadcast broadcast);
}
