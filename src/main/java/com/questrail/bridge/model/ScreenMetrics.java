package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Running statistics of a screen capture session.
 *
 * @param latency   milliseconds from capture to delivery of the last frame
 * @param bandwidth bytes per second
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScreenMetrics(
        double frameRate,
        double latency,
        double bandwidth,
        long droppedFrames
) {
}
