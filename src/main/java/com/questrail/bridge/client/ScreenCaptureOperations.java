package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.CaptureQuality;
import com.questrail.bridge.model.CaptureSession;
import com.questrail.bridge.model.DevicePlatform;
import com.questrail.bridge.model.ScreenMetrics;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Screen mirroring sessions. Frames arrive as {@code screen:frame}
 * broadcasts; subscribe to {@link MessageKind#SCREEN} to receive them.
 */
public final class ScreenCaptureOperations extends OperationSupport
{
    private static final TypeReference<List<CaptureSession>> SESSIONS = new TypeReference<>() {};

    ScreenCaptureOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.SCREEN);
    }

    public CompletableFuture<CaptureSession> start(String deviceId, DevicePlatform platform, CaptureQuality quality)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(platform, "platform");

        ObjectNode payload = payload("start");
        payload.put("deviceId", deviceId);
        payload.set("platform", tree(platform));
        if (quality != null) {
            payload.set("quality", tree(quality));
        }
        return call(deviceId, payload, "Failed to start screen capture", field("session", CaptureSession.class));
    }

    public CompletableFuture<Void> stop(String sessionId)
    {
        return run("", sessionPayload("stop", sessionId), "Failed to stop screen capture");
    }

    public CompletableFuture<Void> setQuality(String sessionId, CaptureQuality quality)
    {
        ObjectNode payload = sessionPayload("set-quality", sessionId);
        payload.set("quality", tree(Objects.requireNonNull(quality, "quality")));
        return run("", payload, "Failed to set capture quality");
    }

    public CompletableFuture<ScreenMetrics> metrics(String sessionId)
    {
        return call("", sessionPayload("get-metrics", sessionId), "Failed to get capture metrics",
                field("metrics", ScreenMetrics.class));
    }

    public CompletableFuture<Double> frameRate(String sessionId)
    {
        return call("", sessionPayload("get-frame-rate", sessionId), "Failed to get frame rate",
                field("frameRate", Double.class));
    }

    /**
     * @return capture-to-delivery latency in milliseconds
     */
    public CompletableFuture<Double> latency(String sessionId)
    {
        return call("", sessionPayload("get-latency", sessionId), "Failed to get latency",
                field("latency", Double.class));
    }

    public CompletableFuture<List<CaptureSession>> listSessions()
    {
        return call("", payload("list-sessions"), "Failed to list capture sessions", field("sessions", SESSIONS));
    }

    private ObjectNode sessionPayload(String action, String sessionId)
    {
        ObjectNode payload = payload(action);
        payload.put("sessionId", Objects.requireNonNull(sessionId, "sessionId"));
        return payload;
    }
}
