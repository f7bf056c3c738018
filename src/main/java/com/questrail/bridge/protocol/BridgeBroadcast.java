package com.questrail.bridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Unsolicited inbound message of a known {@link MessageKind}.
 *
 * @param kind  kind resolved from the topic prefix
 * @param topic full wire type, e.g. {@code terminal:command:complete}
 * @param data  message body ({@code data}, falling back to {@code payload});
 *              never {@code null}, a missing node when absent
 */
public record BridgeBroadcast(
        MessageKind kind,
        String topic,
        JsonNode data
) implements InboundMessage {

    public BridgeBroadcast {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(data, "data");
    }
}
