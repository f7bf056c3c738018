package com.questrail.bridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.api.ConnectionState;
import com.questrail.bridge.api.ErrorListener;
import com.questrail.bridge.api.ReconnectListener;
import com.questrail.bridge.config.BridgeClientConfig;
import com.questrail.bridge.connection.ConnectionManager;
import com.questrail.bridge.error.BridgeConnectionException;
import com.questrail.bridge.internal.exec.OutboundQueue;
import com.questrail.bridge.internal.exec.PendingRequestTable;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.MonotonicScheduler;
import com.questrail.bridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.bridge.internal.time.SystemMonotonicClock;
import com.questrail.bridge.internal.time.SystemWallClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.bridge.protocol.BridgeBroadcast;
import com.questrail.bridge.protocol.BridgeDecodeException;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.BridgeRequest;
import com.questrail.bridge.protocol.BridgeResponse;
import com.questrail.bridge.protocol.InboundMessage;
import com.questrail.bridge.protocol.MessageKind;
import com.questrail.bridge.protocol.UnroutableMessage;
import com.questrail.bridge.routing.BroadcastListener;
import com.questrail.bridge.routing.BroadcastRouter;
import com.questrail.bridge.routing.UnroutedListener;
import com.questrail.bridge.transport.MessageEndpointFactory;
import com.questrail.bridge.transport.websocket.netty.NettyWebSocketEndpointFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DeviceBridgeClient
 * =============================================================================
 * Composition root and lifecycle owner for one bridge connection.
 *
 * <p>Wires the codec, pending request table, outbound queue, broadcast
 * router and connection manager together, and routes every decoded inbound
 * frame: responses settle their pending request, broadcasts go to the
 * router, anything undecodable is reported and dropped.</p>
 *
 * <h2>Owned resources</h2>
 * When the builder is not given a scheduler, the client creates a
 * single-thread {@link ScheduledExecutorService} for its timers. When it is
 * not given an endpoint factory, it creates a Netty factory with its own
 * event loop. {@link #close()} shuts down exactly what the client created.
 */
public final class DeviceBridgeClient implements BridgeClient
{
    private static final Logger log = LoggerFactory.getLogger(DeviceBridgeClient.class);

    private final BridgeClientConfig config;
    private final BridgeMessageCodec codec;
    private final PendingRequestTable pendingRequests;
    private final OutboundQueue outboundQueue;
    private final BroadcastRouter router;
    private final ConnectionManager connection;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private final MessageEndpointFactory endpointFactory;
    private final boolean ownsEndpointFactory;
    private final ScheduledExecutorService ownedExecutor;

    private final TerminalOperations terminal;
    private final PermissionOperations permissions;
    private final ScreenCaptureOperations screen;
    private final LogCaptureOperations logs;
    private final DeviceDiscoveryOperations discovery;
    private final AppInstallationOperations apps;

    private final AtomicLong correlationSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private DeviceBridgeClient(Builder builder)
    {
        this.config = builder.config;
        this.wallClock = builder.wallClock;
        this.observabilitySink = builder.observabilitySink;
        this.codec = builder.objectMapper == null
                ? new BridgeMessageCodec()
                : new BridgeMessageCodec(builder.objectMapper);

        MonotonicClock clock = builder.clock;
        MonotonicScheduler scheduler = builder.scheduler;
        if (scheduler == null) {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "device-bridge-timer");
                thread.setDaemon(true);
                return thread;
            });
            scheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
        } else {
            this.ownedExecutor = null;
        }

        if (builder.endpointFactory == null) {
            this.endpointFactory = new NettyWebSocketEndpointFactory(
                    config.endpoint(), config.maxFramePayloadLength());
            this.ownsEndpointFactory = true;
        } else {
            this.endpointFactory = builder.endpointFactory;
            this.ownsEndpointFactory = false;
        }

        this.pendingRequests = new PendingRequestTable(clock, scheduler);
        this.outboundQueue = new OutboundQueue();
        this.router = new BroadcastRouter(observabilitySink, wallClock);
        this.connection = new ConnectionManager(
                endpointFactory,
                codec,
                pendingRequests,
                outboundQueue,
                this::onInboundFrame,
                config.connectTimeout(),
                config.backoffPolicy(),
                clock,
                scheduler,
                wallClock,
                observabilitySink);

        this.terminal = new TerminalOperations(this, codec);
        this.permissions = new PermissionOperations(this, codec);
        this.screen = new ScreenCaptureOperations(this, codec);
        this.logs = new LogCaptureOperations(this, codec);
        this.discovery = new DeviceDiscoveryOperations(this, codec);
        this.apps = new AppInstallationOperations(this, codec);
    }

    /**
     * Client with production wiring: Netty transport, system clock, SLF4J
     * observability.
     */
    public static DeviceBridgeClient create(BridgeClientConfig config)
    {
        return builder().withConfig(config).build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Connection
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> connect()
    {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new BridgeConnectionException("Client is closed"));
        }
        return connection.connect();
    }

    @Override
    public void disconnect()
    {
        connection.disconnect();
    }

    @Override
    public boolean isConnected()
    {
        return connection.isConnected();
    }

    @Override
    public ConnectionState connectionState()
    {
        return connection.state();
    }

    // -------------------------------------------------------------------------
    // Requests
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<BridgeResponse> send(BridgeRequest request)
    {
        Objects.requireNonNull(request, "request");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new BridgeConnectionException("Client is closed"));
        }

        // Register first so the timeout runs from the call, queued or not.
        CompletableFuture<BridgeResponse> response =
                pendingRequests.register(request.correlationId(), config.requestTimeout());
        try {
            connection.transmit(request);
        } catch (RuntimeException e) {
            log.warn("Request {} could not be handed to the transport", request.correlationId(), e);
            pendingRequests.fail(request.correlationId(),
                    new BridgeConnectionException("Failed to send request " + request.correlationId(), e));
        }
        return response;
    }

    @Override
    public CompletableFuture<BridgeResponse> send(MessageKind kind, String targetId, ObjectNode payload)
    {
        return send(new BridgeRequest(kind, targetId, payload, newCorrelationId()));
    }

    @Override
    public String newCorrelationId()
    {
        return wallClock.now().toEpochMilli() + "-" + Long.toString(correlationSequence.incrementAndGet(), 36);
    }

    @Override
    public ObjectNode newPayload()
    {
        return codec.newPayload();
    }

    /**
     * Requests awaiting a response. Diagnostic.
     */
    public int pendingRequestCount()
    {
        return pendingRequests.size();
    }

    /**
     * Requests waiting for the connection to open. Diagnostic.
     */
    public int queuedRequestCount()
    {
        return outboundQueue.size();
    }

    // -------------------------------------------------------------------------
    // Listeners
    // -------------------------------------------------------------------------

    @Override
    public void subscribe(MessageKind kind, BroadcastListener listener)
    {
        router.subscribe(kind, listener);
    }

    @Override
    public void unsubscribe(MessageKind kind, BroadcastListener listener)
    {
        router.unsubscribe(kind, listener);
    }

    /**
     * Receive inbound messages whose type maps to no known kind.
     */
    public void onUnrouted(UnroutedListener listener)
    {
        router.addUnroutedListener(listener);
    }

    public void offUnrouted(UnroutedListener listener)
    {
        router.removeUnroutedListener(listener);
    }

    @Override
    public void onError(ErrorListener listener)
    {
        connection.addErrorListener(listener);
    }

    @Override
    public void offError(ErrorListener listener)
    {
        connection.removeErrorListener(listener);
    }

    @Override
    public void onReconnect(ReconnectListener listener)
    {
        connection.addReconnectListener(listener);
    }

    @Override
    public void offReconnect(ReconnectListener listener)
    {
        connection.removeReconnectListener(listener);
    }

    // -------------------------------------------------------------------------
    // Domain operations
    // -------------------------------------------------------------------------

    @Override
    public TerminalOperations terminal()
    {
        return terminal;
    }

    @Override
    public PermissionOperations permissions()
    {
        return permissions;
    }

    @Override
    public ScreenCaptureOperations screen()
    {
        return screen;
    }

    @Override
    public LogCaptureOperations logs()
    {
        return logs;
    }

    @Override
    public DeviceDiscoveryOperations discovery()
    {
        return discovery;
    }

    @Override
    public AppInstallationOperations apps()
    {
        return apps;
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        connection.disconnect();
        connection.clearListeners();
        router.clear();

        if (ownsEndpointFactory) {
            endpointFactory.close();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void onInboundFrame(String frame)
    {
        final InboundMessage message;
        try {
            message = codec.decode(frame);
        } catch (BridgeDecodeException e) {
            observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Dropped undecodable frame", e));
            return;
        }

        if (message instanceof BridgeResponse response) {
            if (!pendingRequests.settle(response)) {
                log.debug("Discarding response for unknown request {}", response.correlationId());
            }
        } else if (message instanceof BridgeBroadcast broadcast) {
            router.dispatch(broadcast);
        } else if (message instanceof UnroutableMessage unroutable) {
            router.dispatchUnrouted(unroutable);
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private BridgeClientConfig config = BridgeClientConfig.defaults();
        private MessageEndpointFactory endpointFactory;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private BridgeObservabilitySink observabilitySink = new Slf4jBridgeObservabilitySink();
        private ObjectMapper objectMapper;

        public Builder withConfig(BridgeClientConfig config)
        {
            this.config = config;
            return this;
        }

        /**
         * Transport to use instead of the default Netty WebSocket factory.
         * The caller keeps ownership and closes it.
         */
        public Builder withEndpointFactory(MessageEndpointFactory factory)
        {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        /**
         * Timer source to use instead of a client-owned executor. Must
         * measure time on the same clock as {@link #withClock}.
         */
        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper)
        {
            this.objectMapper = mapper;
            return this;
        }

        public DeviceBridgeClient build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new DeviceBridgeClient(this);
        }
    }
}
