package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Screen capture quality preset. The remote side picks resolution and
 * bitrate for each preset; {@link #MEDIUM} is its default.
 */
public enum CaptureQuality
{
    @JsonProperty("low")
    LOW,

    @JsonProperty("medium")
    MEDIUM,

    @JsonProperty("high")
    HIGH
}
