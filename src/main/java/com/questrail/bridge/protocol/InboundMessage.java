package com.questrail.bridge.protocol;

/**
 * InboundMessage
 * -----------------------------------------------------------------------------
 * Every decoded inbound frame is exactly one of:
 * <ul>
 *   <li>{@link BridgeResponse}: correlated reply to a request</li>
 *   <li>{@link BridgeBroadcast}: unsolicited message of a known kind</li>
 *   <li>{@link UnroutableMessage}: unsolicited message whose type maps to no
 *       {@link MessageKind}</li>
 * </ul>
 */
public sealed interface InboundMessage
        permits BridgeResponse, BridgeBroadcast, UnroutableMessage
{
}
