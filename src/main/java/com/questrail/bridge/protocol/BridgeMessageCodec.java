package com.questrail.bridge.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * BridgeMessageCodec
 * =============================================================================
 * JSON text codec for the bridge wire envelope.
 *
 * <h2>Wire shapes</h2>
 * <pre>
 *   request   { "type", "deviceId", "payload", "requestId" }
 *   response  { "requestId", "success", "data"?, "error"? }
 *   broadcast { "type": "&lt;kind&gt;:&lt;event&gt;", "data"? | "payload"? }
 * </pre>
 *
 * <p>The codec owns the {@link ObjectMapper}. Domain helpers borrow it
 * through {@link #convert} so response documents and payloads share one
 * configuration (ISO-8601 dates, unknown properties ignored).</p>
 *
 * <p>No transport I/O happens here and nothing is retried.</p>
 */
public final class BridgeMessageCodec
{
    private final ObjectMapper mapper;

    public BridgeMessageCodec() {
        this(defaultMapper());
    }

    public BridgeMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Fresh empty payload document.
     */
    public ObjectNode newPayload() {
        return mapper.createObjectNode();
    }

    /**
     * Encode a request as a single JSON text frame.
     */
    public String encode(BridgeRequest request) {
        Objects.requireNonNull(request, "request");

        ObjectNode node = mapper.createObjectNode();
        node.put("type", request.kind().wireName());
        node.put("deviceId", request.targetId());
        node.set("payload", request.payload());
        node.put("requestId", request.correlationId());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request " + request.correlationId(), e);
        }
    }

    /**
     * Decode one inbound text frame.
     *
     * @throws BridgeDecodeException if the frame is not a well-formed
     *         response or broadcast
     */
    public InboundMessage decode(String text) {
        Objects.requireNonNull(text, "text");

        final JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new BridgeDecodeException("Malformed JSON frame", e);
        }

        if (node == null || !node.isObject()) {
            throw new BridgeDecodeException("Frame is not a JSON object");
        }

        JsonNode requestId = node.get("requestId");
        JsonNode success = node.get("success");
        if (requestId != null && requestId.isTextual() && success != null && success.isBoolean()) {
            return decodeResponse(node, requestId.asText(), success.asBoolean());
        }

        JsonNode type = node.get("type");
        if (type != null && type.isTextual()) {
            return decodeBroadcast(node, type.asText());
        }

        throw new BridgeDecodeException("Frame is neither a response nor a typed broadcast");
    }

    private static BridgeResponse decodeResponse(JsonNode node, String correlationId, boolean success) {
        JsonNode data = node.get("data");
        if (data != null && data.isNull()) {
            data = null;
        }

        JsonNode error = node.get("error");
        String errorText = (error == null || error.isNull()) ? null : error.asText();

        return new BridgeResponse(correlationId, success, data, errorText);
    }

    private static InboundMessage decodeBroadcast(JsonNode node, String type) {
        JsonNode body = node.get("data");
        if (body == null || body.isNull()) {
            body = node.get("payload");
        }
        if (body == null || body.isNull()) {
            body = MissingNode.getInstance();
        }

        JsonNode data = body;
        return MessageKind.fromTopic(type)
                .<InboundMessage>map(kind -> new BridgeBroadcast(kind, type, data))
                .orElseGet(() -> new UnroutableMessage(type, data));
    }

    /**
     * Map a response document onto a value type.
     *
     * @throws IllegalArgumentException if the document does not fit the type
     */
    public <T> T convert(JsonNode node, Class<T> type) {
        return mapper.convertValue(node, type);
    }

    /**
     * Map a response document onto a generic value type (lists of records).
     *
     * @throws IllegalArgumentException if the document does not fit the type
     */
    public <T> T convert(JsonNode node, TypeReference<T> type) {
        return mapper.convertValue(node, type);
    }

    /**
     * Render an arbitrary value (records, lists) as a payload field value.
     */
    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }
}
