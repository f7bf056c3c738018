package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Optional;

/**
 * Result of asking the device to grant one permission.
 *
 * @param error device-side reason when the grant failed; {@code null} otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionRequestResult(
        String permission,
        boolean granted,
        String error
) {
    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
