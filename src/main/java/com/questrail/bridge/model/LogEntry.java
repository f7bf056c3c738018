package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One parsed line of device log output.
 *
 * @param tag logging tag (Android) or subsystem (iOS)
 * @param pid emitting process id; {@code null} when the line carried none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogEntry(
        Instant timestamp,
        LogLevel level,
        String tag,
        String message,
        String deviceId,
        Integer pid
) {
}
