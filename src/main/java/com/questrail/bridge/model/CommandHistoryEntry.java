package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandHistoryEntry(
        String command,
        Instant timestamp,
        int exitCode,
        long duration
) {
}
