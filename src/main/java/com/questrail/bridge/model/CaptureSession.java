package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptureSession(
        String sessionId,
        String deviceId,
        DevicePlatform platform,
        CaptureOptions options,
        Instant startTime,
        boolean isActive,
        ScreenMetrics metrics
) {
}
