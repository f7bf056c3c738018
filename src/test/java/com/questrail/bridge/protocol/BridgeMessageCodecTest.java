package com.questrail.bridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BridgeMessageCodecTest {

    private final BridgeMessageCodec codec = new BridgeMessageCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encodesRequestWithWireFieldNames() throws Exception {
        ObjectNode payload = codec.newPayload();
        payload.put("action", "execute");
        payload.put("sessionId", "s1");
        payload.put("command", "ls -la");

        String frame = codec.encode(new BridgeRequest(MessageKind.TERMINAL, "", payload, "r1"));
        JsonNode node = mapper.readTree(frame);

        assertEquals("terminal", node.get("type").asText());
        assertEquals("", node.get("deviceId").asText());
        assertEquals("r1", node.get("requestId").asText());
        assertEquals("execute", node.get("payload").get("action").asText());
        assertEquals("ls -la", node.get("payload").get("command").asText());
    }

    @Test
    void encodesAppInstallationKindWithHyphenatedName() throws Exception {
        String frame = codec.encode(new BridgeRequest(MessageKind.APP_INSTALLATION, "emulator-5554", codec.newPayload(), "r9"));

        assertEquals("app-installation", mapper.readTree(frame).get("type").asText());
    }

    @Test
    void decodesSuccessfulResponse() {
        InboundMessage message = codec.decode(
                "{\"requestId\":\"r1\",\"success\":true,\"data\":{\"session\":{\"sessionId\":\"s1\"}}}");

        BridgeResponse response = assertInstanceOf(BridgeResponse.class, message);
        assertEquals("r1", response.correlationId());
        assertTrue(response.success());
        assertEquals("s1", response.dataField("session").get("sessionId").asText());
        assertTrue(response.errorMessage().isEmpty());
    }

    @Test
    void decodesFailedResponse() {
        BridgeResponse response = assertInstanceOf(BridgeResponse.class,
                codec.decode("{\"requestId\":\"r2\",\"success\":false,\"error\":\"Session not found\"}"));

        assertFalse(response.success());
        assertEquals("Session not found", response.errorMessage().orElseThrow());
        assertTrue(response.dataField("anything").isMissingNode());
    }

    @Test
    void nullDataAndErrorAreTreatedAsAbsent() {
        BridgeResponse response = assertInstanceOf(BridgeResponse.class,
                codec.decode("{\"requestId\":\"r3\",\"success\":false,\"data\":null,\"error\":null}"));

        assertNull(response.data());
        assertNull(response.error());
    }

    @Test
    void connectionGreetingDecodesAsResponse() {
        InboundMessage message = codec.decode(
                "{\"requestId\":\"connection\",\"success\":true,\"data\":{\"clientId\":\"c1\"}}");

        assertEquals("connection", assertInstanceOf(BridgeResponse.class, message).correlationId());
    }

    @Test
    void decodesBroadcastByTopicPrefix() {
        BridgeBroadcast broadcast = assertInstanceOf(BridgeBroadcast.class,
                codec.decode("{\"type\":\"terminal:output\",\"data\":{\"sessionId\":\"s1\",\"output\":\"hi\"}}"));

        assertEquals(MessageKind.TERMINAL, broadcast.kind());
        assertEquals("terminal:output", broadcast.topic());
        assertEquals("hi", broadcast.data().get("output").asText());
    }

    @Test
    void broadcastFallsBackToPayloadBody() {
        BridgeBroadcast broadcast = assertInstanceOf(BridgeBroadcast.class,
                codec.decode("{\"type\":\"screen:frame\",\"payload\":{\"frameNumber\":7}}"));

        assertEquals(MessageKind.SCREEN, broadcast.kind());
        assertEquals(7, broadcast.data().get("frameNumber").asInt());
    }

    @Test
    void broadcastWithoutBodyHasMissingData() {
        BridgeBroadcast broadcast = assertInstanceOf(BridgeBroadcast.class, codec.decode("{\"type\":\"log\"}"));

        assertTrue(broadcast.data().isMissingNode());
    }

    @Test
    void appPrefixMapsToAppInstallation() {
        BridgeBroadcast broadcast = assertInstanceOf(BridgeBroadcast.class,
                codec.decode("{\"type\":\"app:log\",\"data\":{\"packageName\":\"com.example\"}}"));

        assertEquals(MessageKind.APP_INSTALLATION, broadcast.kind());
    }

    @Test
    void unknownTypeIsUnroutableNotDropped() {
        UnroutableMessage message = assertInstanceOf(UnroutableMessage.class,
                codec.decode("{\"type\":\"device:connected\",\"data\":{\"id\":\"d1\"}}"));

        assertEquals("device:connected", message.type());
        assertEquals("d1", message.data().get("id").asText());
    }

    @Test
    void malformedJsonIsADecodeFailure() {
        assertThrows(BridgeDecodeException.class, () -> codec.decode("{not json"));
    }

    @Test
    void nonObjectFrameIsADecodeFailure() {
        assertThrows(BridgeDecodeException.class, () -> codec.decode("[1,2,3]"));
        assertThrows(BridgeDecodeException.class, () -> codec.decode("\"text\""));
    }

    @Test
    void objectWithoutRequestIdOrTypeIsADecodeFailure() {
        assertThrows(BridgeDecodeException.class, () -> codec.decode("{\"success\":true}"));
        assertThrows(BridgeDecodeException.class, () -> codec.decode("{\"requestId\":\"r1\"}"));
    }

    @Test
    void messageKindResolvesWireNamesAndTopics() {
        assertEquals(MessageKind.PERMISSION, MessageKind.fromWireName("permission").orElseThrow());
        assertTrue(MessageKind.fromWireName("app").isEmpty());
        assertEquals(MessageKind.DISCOVERY, MessageKind.fromTopic("discovery").orElseThrow());
        assertEquals(MessageKind.LOG, MessageKind.fromTopic("log:entry").orElseThrow());
        assertTrue(MessageKind.fromTopic("unknown:thing").isEmpty());
    }

    @Test
    void requestRejectsEmptyCorrelationIdAndNormalisesTarget() {
        assertThrows(IllegalArgumentException.class, () ->
                new BridgeRequest(MessageKind.LOG, "d1", codec.newPayload(), ""));

        BridgeRequest request = new BridgeRequest(MessageKind.LOG, null, codec.newPayload(), "r1");
        assertEquals("", request.targetId());
        assertEquals("", request.action());
    }
}
