package com.questrail.bridge.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Outbound request envelope.
 *
 * @param kind          sub-protocol the payload belongs to
 * @param targetId      remote device the request addresses; empty for
 *                      session-scoped operations
 * @param payload       operation arguments, carrying an {@code action}
 *                      discriminator for most kinds
 * @param correlationId token echoed by the remote in its response; unique
 *                      among in-flight requests
 */
public record BridgeRequest(
        MessageKind kind,
        String targetId,
        ObjectNode payload,
        String correlationId
) {
    public BridgeRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(correlationId, "correlationId");
        targetId = targetId == null ? "" : targetId;

        if (correlationId.isEmpty()) {
            throw new IllegalArgumentException("correlationId must not be empty");
        }
    }

    /**
     * The {@code action} discriminator, or an empty string when the kind
     * does not use one.
     */
    public String action() {
        return payload.path("action").asText("");
    }
}
