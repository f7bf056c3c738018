package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PermissionStatus
{
    @JsonProperty("granted")
    GRANTED,

    @JsonProperty("denied")
    DENIED,

    @JsonProperty("not_requested")
    NOT_REQUESTED
}
