package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.Permission;
import com.questrail.bridge.model.PermissionRequestResult;
import com.questrail.bridge.model.PermissionStatus;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runtime permissions of apps installed on a device.
 */
public final class PermissionOperations extends OperationSupport
{
    private static final TypeReference<List<Permission>> PERMISSIONS = new TypeReference<>() {};
    private static final TypeReference<List<PermissionRequestResult>> RESULTS = new TypeReference<>() {};

    PermissionOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.PERMISSION);
    }

    /**
     * Permissions known to the device, optionally narrowed to one app.
     *
     * @param appId package or bundle id; {@code null} for all apps
     */
    public CompletableFuture<List<Permission>> list(String deviceId, String appId)
    {
        ObjectNode payload = devicePayload("list", deviceId);
        if (appId != null) {
            payload.put("appId", appId);
        }
        return call(deviceId, payload, "Failed to list permissions", field("permissions", PERMISSIONS));
    }

    public CompletableFuture<List<Permission>> list(String deviceId)
    {
        return list(deviceId, null);
    }

    public CompletableFuture<PermissionStatus> status(String deviceId, String appId, String permission)
    {
        ObjectNode payload = appPayload("get-status", deviceId, appId);
        payload.put("permission", Objects.requireNonNull(permission, "permission"));
        return call(deviceId, payload, "Failed to get permission status", field("status", PermissionStatus.class));
    }

    public CompletableFuture<PermissionRequestResult> request(String deviceId, String appId, String permission)
    {
        ObjectNode payload = appPayload("request", deviceId, appId);
        payload.put("permission", Objects.requireNonNull(permission, "permission"));
        return call(deviceId, payload, "Failed to request permission", field("result", PermissionRequestResult.class));
    }

    public CompletableFuture<List<PermissionRequestResult>> requestMultiple(String deviceId,
                                                                            String appId,
                                                                            List<String> permissions)
    {
        Objects.requireNonNull(permissions, "permissions");

        ObjectNode payload = appPayload("request-multiple", deviceId, appId);
        ArrayNode names = payload.putArray("permissions");
        permissions.forEach(names::add);
        return call(deviceId, payload, "Failed to request permissions", field("results", RESULTS));
    }

    /**
     * @return whether the device reports the permission as revoked
     */
    public CompletableFuture<Boolean> revoke(String deviceId, String appId, String permission)
    {
        ObjectNode payload = appPayload("revoke", deviceId, appId);
        payload.put("permission", Objects.requireNonNull(permission, "permission"));
        return call(deviceId, payload, "Failed to revoke permission", field("revoked", Boolean.class));
    }

    private ObjectNode devicePayload(String action, String deviceId)
    {
        ObjectNode payload = payload(action);
        payload.put("deviceId", Objects.requireNonNull(deviceId, "deviceId"));
        return payload;
    }

    private ObjectNode appPayload(String action, String deviceId, String appId)
    {
        ObjectNode payload = devicePayload(action, deviceId);
        payload.put("appId", Objects.requireNonNull(appId, "appId"));
        return payload;
    }
}
