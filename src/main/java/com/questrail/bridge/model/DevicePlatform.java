package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operating system family of a remote device.
 */
public enum DevicePlatform
{
    @JsonProperty("android")
    ANDROID,

    @JsonProperty("ios")
    IOS
}
