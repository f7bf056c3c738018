package com.questrail.bridge.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bridge.api.ConnectionState;
import com.questrail.bridge.error.BridgeConnectionException;
import com.questrail.bridge.error.BridgeException;
import com.questrail.bridge.error.BridgeTimeoutException;
import com.questrail.bridge.error.ExhaustedRetriesException;
import com.questrail.bridge.internal.exec.BackoffPolicy;
import com.questrail.bridge.internal.exec.OutboundQueue;
import com.questrail.bridge.internal.exec.PendingRequestTable;
import com.questrail.bridge.internal.time.SystemWallClock;
import com.questrail.bridge.observability.BridgeWireEvent;
import com.questrail.bridge.observability.RecordingObservabilitySink;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.BridgeRequest;
import com.questrail.bridge.protocol.BridgeResponse;
import com.questrail.bridge.protocol.MessageKind;
import com.questrail.bridge.time.DeterministicScheduler;
import com.questrail.bridge.time.ManualMonotonicClock;
import com.questrail.bridge.transport.FakeMessageEndpointFactory;
import com.questrail.bridge.transport.FakeMessageEndpointFactory.FakeEndpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionManagerTest
 * -----------------------------------------------------------------------------
 * Lifecycle, backoff and replay driven entirely by the manual clock and the
 * fake transport: nothing here touches a socket or sleeps.
 */
class ConnectionManagerTest {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final ObjectMapper mapper = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeMessageEndpointFactory factory;
    private RecordingObservabilitySink sink;
    private BridgeMessageCodec codec;
    private PendingRequestTable pending;
    private OutboundQueue queue;
    private List<String> inboundFrames;
    private List<BridgeException> errors;
    private AtomicInteger reconnects;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        factory = new FakeMessageEndpointFactory();
        sink = new RecordingObservabilitySink();
        codec = new BridgeMessageCodec();
        pending = new PendingRequestTable(clock, scheduler);
        queue = new OutboundQueue();
        inboundFrames = new CopyOnWriteArrayList<>();
        errors = new CopyOnWriteArrayList<>();
        reconnects = new AtomicInteger();

        manager = new ConnectionManager(
                factory,
                codec,
                pending,
                queue,
                inboundFrames::add,
                Duration.ofSeconds(10),
                BackoffPolicy.defaults(),
                clock,
                scheduler,
                SystemWallClock.INSTANCE,
                sink);
        manager.addErrorListener(errors::add);
        manager.addReconnectListener(reconnects::incrementAndGet);
    }

    private BridgeRequest request(String id) {
        return new BridgeRequest(MessageKind.TERMINAL, "", codec.newPayload().put("action", "history"), id);
    }

    private CompletableFuture<BridgeResponse> send(String id) {
        CompletableFuture<BridgeResponse> future = pending.register(id, REQUEST_TIMEOUT);
        manager.transmit(request(id));
        return future;
    }

    private List<String> sentIds(FakeEndpoint endpoint) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String frame : endpoint.sent()) {
            ids.add(mapper.readTree(frame).get("requestId").asText());
        }
        return ids;
    }

    private long exhaustedCount() {
        return errors.stream().filter(e -> e instanceof ExhaustedRetriesException).count();
    }

    private void connectAndOpen() {
        CompletableFuture<Void> connected = manager.connect();
        factory.latest().open();
        assertTrue(connected.isDone());
    }

    // -------------------------------------------------------------------------
    // connect()
    // -------------------------------------------------------------------------

    @Test
    void connectCompletesOnceTransportOpens() {
        CompletableFuture<Void> connected = manager.connect();

        assertEquals(ConnectionState.CONNECTING, manager.state());
        assertFalse(connected.isDone());
        assertTrue(factory.latest().isStarted());

        factory.latest().open();

        assertDoesNotThrow(() -> connected.join());
        assertTrue(manager.isConnected());
        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED), sink.getStates());
        assertEquals(0, reconnects.get());
    }

    @Test
    void connectWhenConnectedCompletesImmediatelyWithoutNewTransport() {
        connectAndOpen();

        CompletableFuture<Void> again = manager.connect();

        assertTrue(again.isDone());
        assertEquals(1, factory.createdCount());
    }

    @Test
    void concurrentConnectCallsShareOneAttempt() {
        CompletableFuture<Void> first = manager.connect();
        CompletableFuture<Void> second = manager.connect();

        assertEquals(1, factory.createdCount());

        factory.latest().open();

        assertTrue(first.isDone());
        assertTrue(second.isDone());
    }

    @Test
    void connectFailsWithTimeoutWhenTransportNeverOpens() {
        CompletableFuture<Void> connected = manager.connect();

        scheduler.advanceMillis(9_999);
        assertFalse(connected.isDone());

        scheduler.advanceMillis(1);

        CompletionException thrown = assertThrows(CompletionException.class, connected::join);
        assertInstanceOf(BridgeTimeoutException.class, thrown.getCause());
        assertTrue(factory.latest().isStopped());
        assertEquals(ConnectionState.RECONNECTING, manager.state());
        assertEquals(List.of(1000L), scheduler.pendingDelaysMillis());
    }

    @Test
    void connectFailsWhenTransportRefuses() {
        CompletableFuture<Void> connected = manager.connect();

        factory.latest().drop(new IOException("Connection refused"));

        CompletionException thrown = assertThrows(CompletionException.class, connected::join);
        BridgeConnectionException cause = assertInstanceOf(BridgeConnectionException.class, thrown.getCause());
        assertInstanceOf(IOException.class, cause.getCause());
        assertEquals(ConnectionState.RECONNECTING, manager.state());
        // A failed first attempt is the caller's failure, not a dropped connection.
        assertTrue(errors.isEmpty());
    }

    // -------------------------------------------------------------------------
    // Reconnection
    // -------------------------------------------------------------------------

    @Test
    void backoffFollowsPolicyThenFailsWithSingleExhaustedNotification() {
        connectAndOpen();
        factory.latest().drop(new IOException("reset by peer"));

        List<Long> delays = new ArrayList<>();
        for (int attempt = 0; attempt < 5; attempt++) {
            List<Long> scheduled = scheduler.pendingDelaysMillis();
            assertEquals(1, scheduled.size(), "one retry armed at attempt " + attempt);
            delays.add(scheduled.get(0));

            scheduler.advanceMillis(scheduled.get(0));
            assertEquals(ConnectionState.RECONNECTING, manager.state());
            factory.latest().drop(new IOException("refused"));
        }

        assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16000L), delays);
        assertEquals(ConnectionState.FAILED, manager.state());
        assertEquals(1, exhaustedCount());
        assertEquals(0, scheduler.liveTaskCount());

        // Nothing more happens on its own.
        scheduler.advanceMillis(120_000);
        assertEquals(ConnectionState.FAILED, manager.state());
        assertEquals(6, factory.createdCount());
        assertEquals(1, exhaustedCount());
    }

    @Test
    void unexpectedCloseIsReportedToErrorListeners() {
        connectAndOpen();

        factory.latest().drop(new IOException("reset by peer"));

        assertEquals(1, errors.size());
        assertInstanceOf(BridgeConnectionException.class, errors.get(0));
        assertEquals(ConnectionState.RECONNECTING, manager.state());
    }

    @Test
    void reconnectListenersFireOnlyForReconnection() {
        connectAndOpen();
        assertEquals(0, reconnects.get());

        factory.latest().drop(null);
        scheduler.advanceMillis(1000);
        factory.latest().open();

        assertEquals(1, reconnects.get());
        assertEquals(ConnectionState.CONNECTED, manager.state());
    }

    @Test
    void successfulReconnectResetsBackoff() {
        connectAndOpen();
        factory.latest().drop(null);
        scheduler.advanceMillis(1000);
        factory.latest().drop(null);
        assertEquals(List.of(2000L), scheduler.pendingDelaysMillis());

        scheduler.advanceMillis(2000);
        factory.latest().open();
        factory.latest().drop(null);

        assertEquals(List.of(1000L), scheduler.pendingDelaysMillis());
    }

    @Test
    void explicitConnectFromFailedStartsOver() {
        manager = new ConnectionManager(factory, codec, pending, queue, inboundFrames::add,
                Duration.ofSeconds(10),
                new BackoffPolicy(Duration.ofMillis(1000), 2.0, Duration.ofMillis(30_000), 1),
                clock, scheduler, SystemWallClock.INSTANCE, sink);
        manager.addErrorListener(errors::add);

        connectAndOpen();
        factory.latest().drop(null);
        scheduler.advanceMillis(1000);
        factory.latest().drop(null);
        assertEquals(ConnectionState.FAILED, manager.state());

        CompletableFuture<Void> connected = manager.connect();
        assertEquals(ConnectionState.CONNECTING, manager.state());
        factory.latest().open();

        assertTrue(connected.isDone());
        assertTrue(manager.isConnected());
    }

    @Test
    void explicitConnectDuringBackoffOpensImmediately() {
        connectAndOpen();
        factory.latest().drop(null);
        assertEquals(ConnectionState.RECONNECTING, manager.state());

        CompletableFuture<Void> connected = manager.connect();

        assertEquals(2, factory.createdCount());
        // Backoff timer gone; only the connect timeout remains.
        assertEquals(List.of(10_000L), scheduler.pendingDelaysMillis());
        factory.latest().open();
        assertTrue(connected.isDone());
        assertEquals(1, reconnects.get());
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Test
    void transmitWhileConnectedWritesImmediately() throws IOException {
        connectAndOpen();

        send("r1");

        assertEquals(List.of("r1"), sentIds(factory.latest()));
        assertTrue(queue.isEmpty());
        assertEquals(BridgeWireEvent.Direction.OUTBOUND, sink.getWireEvents().get(0).direction());
    }

    @Test
    void transmitWhileDisconnectedQueuesAndStartsConnecting() throws IOException {
        send("r1");

        assertEquals(1, queue.size());
        assertEquals(ConnectionState.CONNECTING, manager.state());

        factory.latest().open();

        assertEquals(List.of("r1"), sentIds(factory.latest()));
        assertTrue(queue.isEmpty());
    }

    @Test
    void transmitWhileFailedQueuesWithoutConnecting() {
        manager = new ConnectionManager(factory, codec, pending, queue, inboundFrames::add,
                Duration.ofSeconds(10),
                new BackoffPolicy(Duration.ofMillis(1000), 2.0, Duration.ofMillis(30_000), 0),
                clock, scheduler, SystemWallClock.INSTANCE, sink);
        connectAndOpen();
        factory.latest().drop(null);
        assertEquals(ConnectionState.FAILED, manager.state());

        send("r1");

        assertEquals(1, queue.size());
        assertEquals(1, factory.createdCount());
        assertEquals(ConnectionState.FAILED, manager.state());
    }

    @Test
    void requestsQueuedWhileReconnectingReplayInSendOrder() throws IOException {
        connectAndOpen();
        factory.latest().drop(null);

        send("a");
        send("b");
        send("c");
        assertEquals(3, queue.size());

        scheduler.advanceMillis(1000);
        FakeEndpoint reconnected = factory.latest();
        reconnected.open();

        assertEquals(List.of("a", "b", "c"), sentIds(reconnected));
        assertTrue(queue.isEmpty());
    }

    @Test
    void requestSentFromAnotherThreadDuringReplayGoesBehindTheSnapshot() throws Exception {
        send("q1");
        send("q2");
        send("q3");
        FakeEndpoint endpoint = factory.latest();

        AtomicBoolean sentLate = new AtomicBoolean();
        endpoint.beforeWrite(frame -> {
            if (frame.contains("\"q1\"") && sentLate.compareAndSet(false, true)) {
                Thread sender = new Thread(() -> send("late"), "late-sender");
                sender.start();
                try {
                    sender.join(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                assertFalse(sender.isAlive(), "sender blocked behind the replay");
            }
        });

        endpoint.open();

        assertTrue(sentLate.get());
        assertEquals(List.of("q1", "q2", "q3", "late"), sentIds(endpoint));
        assertTrue(queue.isEmpty());
    }

    @Test
    void transmitAfterReplayWritesDirectly() throws IOException {
        send("q1");
        factory.latest().open();

        send("r1");

        assertEquals(List.of("q1", "r1"), sentIds(factory.latest()));
        assertTrue(queue.isEmpty());
    }

    @Test
    void replaySkipsRequestsThatAlreadySettled() throws IOException {
        CompletableFuture<BridgeResponse> first = send("a");
        send("b");
        first.cancel(true);

        factory.latest().open();

        assertEquals(List.of("b"), sentIds(factory.latest()));
    }

    @Test
    void failedWriteWhileConnectedIsQueuedForNextConnection() throws IOException {
        connectAndOpen();
        factory.latest().failWrites(true);

        send("r1");

        assertEquals(1, queue.size());

        factory.latest().drop(null);
        scheduler.advanceMillis(1000);
        factory.latest().open();

        assertEquals(List.of("r1"), sentIds(factory.latest()));
    }

    // -------------------------------------------------------------------------
    // disconnect()
    // -------------------------------------------------------------------------

    @Test
    void disconnectRejectsPendingAndDiscardsQueue() {
        CompletableFuture<BridgeResponse> queued = send("r1");
        CompletableFuture<Void> connecting = manager.connect();

        manager.disconnect();

        CompletionException thrown = assertThrows(CompletionException.class, queued::join);
        BridgeConnectionException cause = assertInstanceOf(BridgeConnectionException.class, thrown.getCause());
        assertEquals("Connection closed", cause.getMessage());
        assertThrows(CompletionException.class, connecting::join);
        assertTrue(queue.isEmpty());
        assertEquals(0, pending.size());
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(0, scheduler.liveTaskCount());
        assertTrue(factory.latest().isStopped());
    }

    @Test
    void disconnectIsIdempotent() {
        connectAndOpen();
        manager.disconnect();
        int transitions = sink.getStateTransitions().size();

        assertDoesNotThrow(manager::disconnect);
        assertDoesNotThrow(manager::disconnect);

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(transitions, sink.getStateTransitions().size());
        assertTrue(errors.isEmpty());
    }

    @Test
    void disconnectWhenNeverConnectedIsANoOp() {
        assertDoesNotThrow(manager::disconnect);

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertTrue(sink.getStateTransitions().isEmpty());
    }

    @Test
    void disconnectCancelsScheduledRetry() {
        connectAndOpen();
        factory.latest().drop(null);

        manager.disconnect();
        scheduler.advanceMillis(60_000);

        assertEquals(1, factory.createdCount());
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
    }

    // -------------------------------------------------------------------------
    // Transport events
    // -------------------------------------------------------------------------

    @Test
    void inboundFramesAreHandedOverVerbatim() {
        connectAndOpen();

        factory.latest().inject("{\"type\":\"terminal:output\"}");

        assertEquals(List.of("{\"type\":\"terminal:output\"}"), inboundFrames);
        assertEquals(BridgeWireEvent.Direction.INBOUND, sink.getWireEvents().get(0).direction());
    }

    @Test
    void transportErrorWhileOpenNotifiesErrorListenersAndKeepsConnection() {
        connectAndOpen();

        factory.latest().fail(new IOException("write stalled"));

        assertEquals(1, errors.size());
        assertInstanceOf(IOException.class, errors.get(0).getCause());
        assertTrue(manager.isConnected());
    }

    @Test
    void eventsFromReleasedEndpointAreIgnored() {
        manager.connect();
        FakeEndpoint stale = factory.latest();
        manager.disconnect();
        manager.connect();

        stale.open();
        stale.inject("{\"type\":\"log:entry\"}");

        assertEquals(ConnectionState.CONNECTING, manager.state());
        assertTrue(inboundFrames.isEmpty());
        assertEquals(2, factory.createdCount());
    }

    @Test
    void failingListenerDoesNotBreakNotification() {
        List<BridgeException> seen = new ArrayList<>();
        manager.addErrorListener(e -> {
            throw new IllegalStateException("listener bug");
        });
        manager.addErrorListener(seen::add);
        connectAndOpen();

        factory.latest().drop(null);

        assertEquals(1, seen.size());
        assertTrue(sink.getErrors().stream().anyMatch(e -> e.cause() instanceof IllegalStateException));
    }
}
