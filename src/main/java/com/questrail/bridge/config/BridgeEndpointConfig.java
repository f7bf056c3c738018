package com.questrail.bridge.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Location of the bridge proxy's WebSocket endpoint.
 *
 * @param secure {@code true} for {@code wss}, {@code false} for {@code ws}
 */
public record BridgeEndpointConfig(
    String host,
    int port,
    String path,
    boolean secure
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 3001;
    public static final String DEFAULT_PATH = "/";

    public BridgeEndpointConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(path, "path");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
    }

    /**
     * {@code ws://localhost:3001/}
     */
    public static BridgeEndpointConfig defaults() {
        return new BridgeEndpointConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_PATH, false);
    }

    /**
     * Endpoint whose security follows the scheme of the hosting context:
     * {@code https} selects {@code wss}, anything else {@code ws}.
     */
    public static BridgeEndpointConfig mirroring(String hostingScheme, String host, int port, String path) {
        Objects.requireNonNull(hostingScheme, "hostingScheme");
        return new BridgeEndpointConfig(host, port, path, "https".equalsIgnoreCase(hostingScheme));
    }

    /**
     * Parse a {@code ws://} or {@code wss://} URI. A missing port defaults to
     * {@value #DEFAULT_PORT} and a missing path to {@code /}.
     */
    public static BridgeEndpointConfig parse(String uri) {
        URI parsed = URI.create(Objects.requireNonNull(uri, "uri"));
        String scheme = parsed.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported scheme: " + scheme);
        }
        if (parsed.getHost() == null) {
            throw new IllegalArgumentException("Missing host: " + uri);
        }

        int port = parsed.getPort() == -1 ? DEFAULT_PORT : parsed.getPort();
        String path = parsed.getPath() == null || parsed.getPath().isEmpty() ? DEFAULT_PATH : parsed.getPath();
        return new BridgeEndpointConfig(parsed.getHost(), port, path, "wss".equalsIgnoreCase(scheme));
    }

    public String scheme() {
        return secure ? "wss" : "ws";
    }

    /**
     * IPv6 literals are bracketed and path characters quoted as needed.
     */
    public URI toUri() {
        try {
            return new URI(scheme(), null, host, port, path, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid bridge endpoint " + host + ":" + port + path, e);
        }
    }
}
