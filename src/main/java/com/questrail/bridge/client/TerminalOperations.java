package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.model.CommandHistoryEntry;
import com.questrail.bridge.model.CommandResult;
import com.questrail.bridge.model.DevicePlatform;
import com.questrail.bridge.model.TerminalSession;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.MessageKind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Remote shell sessions.
 *
 * <p>{@link #create} addresses a device; every other operation addresses an
 * existing session by id and leaves the request's target empty. Command
 * output is also streamed as {@code terminal:output} broadcasts, which
 * callers receive by subscribing to {@link MessageKind#TERMINAL}.</p>
 */
public final class TerminalOperations extends OperationSupport
{
    private static final TypeReference<List<CommandHistoryEntry>> HISTORY = new TypeReference<>() {};
    private static final TypeReference<List<TerminalSession>> SESSIONS = new TypeReference<>() {};

    TerminalOperations(BridgeClient client, BridgeMessageCodec codec)
    {
        super(client, codec, MessageKind.TERMINAL);
    }

    public CompletableFuture<TerminalSession> create(String deviceId, DevicePlatform platform)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(platform, "platform");

        ObjectNode payload = payload("create");
        payload.put("deviceId", deviceId);
        payload.set("platform", tree(platform));
        return call(deviceId, payload, "Failed to create terminal session", field("session", TerminalSession.class));
    }

    public CompletableFuture<CommandResult> execute(String sessionId, String command)
    {
        ObjectNode payload = sessionPayload("execute", sessionId);
        payload.put("command", Objects.requireNonNull(command, "command"));
        return call("", payload, "Failed to execute command", field("result", CommandResult.class));
    }

    /**
     * Write raw input to the session's standard input.
     */
    public CompletableFuture<Void> sendInput(String sessionId, String input)
    {
        ObjectNode payload = sessionPayload("input", sessionId);
        payload.put("input", Objects.requireNonNull(input, "input"));
        return run("", payload, "Failed to send input");
    }

    public CompletableFuture<Void> interrupt(String sessionId)
    {
        return run("", sessionPayload("interrupt", sessionId), "Failed to interrupt command");
    }

    public CompletableFuture<Void> close(String sessionId)
    {
        return run("", sessionPayload("close", sessionId), "Failed to close session");
    }

    public CompletableFuture<List<CommandHistoryEntry>> history(String sessionId)
    {
        return call("", sessionPayload("history", sessionId), "Failed to get history", field("history", HISTORY));
    }

    public CompletableFuture<Void> clearHistory(String sessionId)
    {
        return run("", sessionPayload("clear-history", sessionId), "Failed to clear history");
    }

    public CompletableFuture<Void> changeDirectory(String sessionId, String directory)
    {
        ObjectNode payload = sessionPayload("change-directory", sessionId);
        payload.put("directory", Objects.requireNonNull(directory, "directory"));
        return run("", payload, "Failed to change directory");
    }

    /**
     * Sessions the bridge currently holds open, across all devices.
     */
    public CompletableFuture<List<TerminalSession>> listSessions()
    {
        return call("", payload("list-sessions"), "Failed to list sessions", field("sessions", SESSIONS));
    }

    private ObjectNode sessionPayload(String action, String sessionId)
    {
        ObjectNode payload = payload(action);
        payload.put("sessionId", Objects.requireNonNull(sessionId, "sessionId"));
        return payload;
    }
}
