package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * A shell session opened on a remote device.
 *
 * <p>Some bridge versions report the session identifier as {@code id}
 * rather than {@code sessionId}; both are accepted.</p>
 *
 * @param shell            {@code sh}, {@code bash} or {@code zsh}
 * @param workingDirectory current directory on the device
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerminalSession(
        @JsonAlias("id") String sessionId,
        String deviceId,
        DevicePlatform platform,
        String shell,
        String workingDirectory,
        Map<String, String> environment,
        boolean isActive,
        Instant createdAt
) {
    public TerminalSession {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
