package com.questrail.bridge.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.client.AppInstallationOperations;
import com.questrail.bridge.client.DeviceDiscoveryOperations;
import com.questrail.bridge.client.LogCaptureOperations;
import com.questrail.bridge.client.PermissionOperations;
import com.questrail.bridge.client.ScreenCaptureOperations;
import com.questrail.bridge.client.TerminalOperations;
import com.questrail.bridge.protocol.BridgeRequest;
import com.questrail.bridge.protocol.BridgeResponse;
import com.questrail.bridge.protocol.MessageKind;
import com.questrail.bridge.routing.BroadcastListener;

import java.util.concurrent.CompletableFuture;

/**
 * BridgeClient
 * =============================================================================
 * Request/response client for one device-bridge connection.
 *
 * <h2>Construction and teardown</h2>
 * Each instance owns its connection, pending requests, outbound queue and
 * subscriber registry; any number of independent clients may coexist.
 * {@link #close()} disconnects, drops every listener and releases the
 * threads the client created. A closed client fails every further request.
 *
 * <h2>Request outcomes</h2>
 * Futures returned by {@link #send(BridgeRequest)} and the domain
 * operations complete with the response, or fail with:
 * <ul>
 *   <li>{@link com.questrail.bridge.error.BridgeProtocolException} when the
 *       remote side reports failure</li>
 *   <li>{@link com.questrail.bridge.error.BridgeTimeoutException} when no
 *       response arrives within the request timeout</li>
 *   <li>{@link com.questrail.bridge.error.BridgeConnectionException} when
 *       {@link #disconnect()} or {@link #close()} intervenes</li>
 * </ul>
 * Cancelling a future abandons the request locally; the remote side is not
 * told.
 *
 * <h2>Connection errors</h2>
 * Failures that belong to no single request are delivered to
 * {@link ErrorListener}s only.
 */
public interface BridgeClient extends AutoCloseable
{
    CompletableFuture<Void> connect();

    void disconnect();

    boolean isConnected();

    ConnectionState connectionState();

    /**
     * Send a fully built request. Written immediately when connected,
     * otherwise queued and replayed in order once the connection opens.
     *
     * @throws IllegalStateException if the correlation id is still in flight
     */
    CompletableFuture<BridgeResponse> send(BridgeRequest request);

    /**
     * Send a request under a fresh correlation id.
     */
    CompletableFuture<BridgeResponse> send(MessageKind kind, String targetId, ObjectNode payload);

    void subscribe(MessageKind kind, BroadcastListener listener);

    void unsubscribe(MessageKind kind, BroadcastListener listener);

    void onError(ErrorListener listener);

    void offError(ErrorListener listener);

    void onReconnect(ReconnectListener listener);

    void offReconnect(ReconnectListener listener);

    /**
     * A correlation id not used before by this client.
     */
    String newCorrelationId();

    /**
     * Empty payload document bound to this client's JSON configuration.
     */
    ObjectNode newPayload();

    TerminalOperations terminal();

    PermissionOperations permissions();

    ScreenCaptureOperations screen();

    LogCaptureOperations logs();

    DeviceDiscoveryOperations discovery();

    AppInstallationOperations apps();

    @Override
    void close();
}
