package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.DevicePlatform;
import com.questrail.bridge.model.LogEntry;
import com.questrail.bridge.model.LogFilter;
import com.questrail.bridge.model.LogSession;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Device log capture. The bridge buffers captured lines per session;
 * {@link #logs} reads the buffer and live lines are also broadcast as
 * {@code log:entry} messages.
 */
public final class LogCaptureOperations extends OperationSupport
{
    private static final TypeReference<List<LogEntry>> ENTRIES = new TypeReference<>() {};
    private static final TypeReference<List<LogSession>> SESSIONS = new TypeReference<>() {};

    LogCaptureOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.LOG);
    }

    /**
     * @param filter initial filter; {@code null} captures everything
     * @return id of the new capture session
     */
    public CompletableFuture<String> start(String deviceId, DevicePlatform platform, LogFilter filter)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(platform, "platform");

        ObjectNode payload = payload("start");
        payload.put("deviceId", deviceId);
        payload.set("platform", tree(platform));
        putFilter(payload, filter);
        return call(deviceId, payload, "Failed to start log capture", field("sessionId", String.class));
    }

    public CompletableFuture<Void> stop(String sessionId)
    {
        return run("", sessionPayload("stop", sessionId), "Failed to stop log capture");
    }

    /**
     * Buffered lines of a session.
     *
     * @param filter applied to this read only; {@code null} for the session's own filter
     */
    public CompletableFuture<List<LogEntry>> logs(String sessionId, LogFilter filter)
    {
        ObjectNode payload = sessionPayload("get-logs", sessionId);
        putFilter(payload, filter);
        return call("", payload, "Failed to get logs", field("logs", ENTRIES));
    }

    public CompletableFuture<List<LogEntry>> logs(String sessionId)
    {
        return logs(sessionId, null);
    }

    public CompletableFuture<Void> clear(String sessionId)
    {
        return run("", sessionPayload("clear", sessionId), "Failed to clear logs");
    }

    public CompletableFuture<Void> setFilter(String sessionId, LogFilter filter)
    {
        ObjectNode payload = sessionPayload("set-filter", sessionId);
        putFilter(payload, Objects.requireNonNull(filter, "filter"));
        return run("", payload, "Failed to set log filter");
    }

    public CompletableFuture<List<LogSession>> listSessions()
    {
        return call("", payload("list-sessions"), "Failed to list log sessions", field("sessions", SESSIONS));
    }

    private ObjectNode sessionPayload(String action, String sessionId)
    {
        ObjectNode payload = payload(action);
        payload.put("sessionId", Objects.requireNonNull(sessionId, "sessionId"));
        return payload;
    }

    private void putFilter(ObjectNode payload, LogFilter filter)
    {
        if (filter != null) {
            payload.set("filter", tree(filter));
        }
    }
}
