package com.questrail.bridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Unsolicited inbound message whose type does not map to any
 * {@link MessageKind}.
 */
public record UnroutableMessage(String type, JsonNode data) implements InboundMessage {

    public UnroutableMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
    }
}
