package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Settings a screen capture session runs with.
 *
 * @param width  requested width in pixels; {@code null} for device native
 * @param height requested height in pixels; {@code null} for device native
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptureOptions(
        CaptureQuality quality,
        int frameRate,
        Integer width,
        Integer height
) {
}
