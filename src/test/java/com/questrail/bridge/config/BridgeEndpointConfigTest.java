package com.questrail.bridge.config;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class BridgeEndpointConfigTest {

    @Test
    void defaultsPointAtLocalBridge() {
        BridgeEndpointConfig config = BridgeEndpointConfig.defaults();

        assertEquals(URI.create("ws://localhost:3001/"), config.toUri());
        assertFalse(config.secure());
    }

    @Test
    void parseFillsMissingPortAndPath() {
        BridgeEndpointConfig config = BridgeEndpointConfig.parse("wss://bridge.example.com");

        assertEquals("bridge.example.com", config.host());
        assertEquals(3001, config.port());
        assertEquals("/", config.path());
        assertTrue(config.secure());
        assertEquals("wss", config.scheme());
    }

    @Test
    void parseKeepsExplicitPortAndPath() {
        BridgeEndpointConfig config = BridgeEndpointConfig.parse("ws://10.0.2.2:8080/bridge");

        assertEquals(8080, config.port());
        assertEquals("/bridge", config.path());
        assertEquals(URI.create("ws://10.0.2.2:8080/bridge"), config.toUri());
    }

    @Test
    void ipv6LiteralHostIsBracketedInUri() {
        BridgeEndpointConfig config = new BridgeEndpointConfig("::1", 3001, "/", false);

        URI uri = config.toUri();

        assertEquals(URI.create("ws://[::1]:3001/"), uri);
        assertEquals("[::1]", uri.getHost());
        assertEquals(3001, uri.getPort());
    }

    @Test
    void parsedIpv6EndpointRoundTrips() {
        BridgeEndpointConfig config = BridgeEndpointConfig.parse("wss://[fe80::1]:8443/bridge");

        assertEquals(8443, config.port());
        assertEquals(URI.create("wss://[fe80::1]:8443/bridge"), config.toUri());
    }

    @Test
    void parseRejectsOtherSchemes() {
        assertThrows(IllegalArgumentException.class, () -> BridgeEndpointConfig.parse("http://localhost:3001/"));
    }

    @Test
    void mirroringFollowsHostingScheme() {
        assertTrue(BridgeEndpointConfig.mirroring("https", "app.example.com", 443, "/ws").secure());
        assertFalse(BridgeEndpointConfig.mirroring("http", "localhost", 3001, "/").secure());
    }

    @Test
    void pathIsAnchored() {
        assertEquals("/ws", new BridgeEndpointConfig("localhost", 3001, "ws", false).path());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BridgeEndpointConfig(" ", 3001, "/", false));
        assertThrows(IllegalArgumentException.class, () -> new BridgeEndpointConfig("localhost", 0, "/", false));
        assertThrows(IllegalArgumentException.class, () -> new BridgeEndpointConfig("localhost", 70000, "/", false));
        assertThrows(NullPointerException.class, () -> new BridgeEndpointConfig(null, 3001, "/", false));
    }
}
