package com.questrail.bridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Inbound reply correlated to a request by {@link #correlationId()}.
 *
 * @param data  result document; {@code null} when absent on the wire
 * @param error remote error text; {@code null} when absent on the wire
 */
public record BridgeResponse(
        String correlationId,
        boolean success,
        JsonNode data,
        String error
) implements InboundMessage {

    public BridgeResponse {
        Objects.requireNonNull(correlationId, "correlationId");
    }

    public static BridgeResponse success(String correlationId, JsonNode data) {
        return new BridgeResponse(correlationId, true, data, null);
    }

    public static BridgeResponse failure(String correlationId, String error) {
        return new BridgeResponse(correlationId, false, null, error);
    }

    /**
     * Field of {@link #data()}, or a missing node when either is absent.
     */
    public JsonNode dataField(String name) {
        return data == null ? MissingNode.getInstance() : data.path(name);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
