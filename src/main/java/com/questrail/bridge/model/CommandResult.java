package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Outcome of one command run in a terminal session.
 *
 * @param duration wall time on the device, in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        long duration
) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
