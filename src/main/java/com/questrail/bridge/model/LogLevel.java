package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Severity of a captured device log line, lowest first.
 */
public enum LogLevel
{
    @JsonProperty("verbose")
    VERBOSE,

    @JsonProperty("debug")
    DEBUG,

    @JsonProperty("info")
    INFO,

    @JsonProperty("warn")
    WARN,

    @JsonProperty("error")
    ERROR,

    @JsonProperty("fatal")
    FATAL
}
