package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One runtime permission declared by an installed app.
 *
 * @param name     platform permission name, e.g. {@code android.permission.CAMERA}
 * @param required whether the app declares the permission as mandatory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Permission(
        String name,
        PermissionStatus status,
        String description,
        boolean required
) {
}
