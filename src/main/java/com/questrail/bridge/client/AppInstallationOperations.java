package com.questrail.bridge.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.DevicePlatform;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Installed-app control: launching a package and following its own log
 * output. Captured lines arrive as {@code app:log} broadcasts carrying
 * {@code deviceId}, {@code packageName} and {@code log}; subscribe with
 * {@link MessageKind#APP_INSTALLATION}.
 */
public final class AppInstallationOperations extends OperationSupport
{
    AppInstallationOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.APP_INSTALLATION);
    }

    /**
     * @return the package name the bridge launched
     */
    public CompletableFuture<String> launch(String deviceId, DevicePlatform platform, String packageName)
    {
        return call(deviceId, appPayload("launch", deviceId, platform, packageName),
                "Failed to launch app", field("packageName", String.class));
    }

    /**
     * Replaces any capture already running for the same device and package.
     */
    public CompletableFuture<Void> startLogCapture(String deviceId, DevicePlatform platform, String packageName)
    {
        return run(deviceId, appPayload("start-log-capture", deviceId, platform, packageName),
                "Failed to start app log capture");
    }

    public CompletableFuture<Void> stopLogCapture(String deviceId, String packageName)
    {
        return run(deviceId, appPayload("stop-log-capture", deviceId, null, packageName),
                "Failed to stop app log capture");
    }

    private ObjectNode appPayload(String action, String deviceId, DevicePlatform platform, String packageName)
    {
        ObjectNode payload = payload(action);
        payload.put("deviceId", Objects.requireNonNull(deviceId, "deviceId"));
        if (platform != null) {
            payload.set("platform", tree(platform));
        }
        payload.put("packageName", Objects.requireNonNull(packageName, "packageName"));
        return payload;
    }
}
