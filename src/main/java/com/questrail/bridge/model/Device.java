package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A device visible to the bridge.
 *
 * @param connectionType {@code usb} or {@code wireless}
 * @param status         {@code connected}, {@code disconnected} or {@code connecting}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Device(
        String id,
        String name,
        DevicePlatform platform,
        String osVersion,
        String model,
        String connectionType,
        String status
) {
    public boolean isConnected() {
        return "connected".equals(status);
    }
}
