package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A log capture running on the bridge for one device.
 *
 * @param filter filter currently applied; {@code null} when unfiltered
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogSession(
        String sessionId,
        String deviceId,
        DevicePlatform platform,
        boolean isActive,
        LogFilter filter
) {
}
