package com.questrail.bridge.connection;

import com.questrail.bridge.api.ConnectionState;
import com.questrail.bridge.api.ErrorListener;
import com.questrail.bridge.api.ReconnectListener;
import com.questrail.bridge.error.BridgeConnectionException;
import com.questrail.bridge.error.BridgeException;
import com.questrail.bridge.error.BridgeTimeoutException;
import com.questrail.bridge.error.ExhaustedRetriesException;
import com.questrail.bridge.internal.exec.BackoffPolicy;
import com.questrail.bridge.internal.exec.OutboundQueue;
import com.questrail.bridge.internal.exec.PendingRequestTable;
import com.questrail.bridge.internal.exec.ReconnectAttemptTracker;
import com.questrail.bridge.internal.time.Cancellable;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.MonotonicScheduler;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgeWireEvent;
import com.questrail.bridge.observability.ConnectionStateTransitionEvent;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.BridgeRequest;
import com.questrail.bridge.transport.MessageEndpoint;
import com.questrail.bridge.transport.MessageEndpointFactory;
import com.questrail.bridge.transport.MessageEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the single transport connection and drives its lifecycle.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Open a fresh {@link MessageEndpoint} per attempt and bound each
 *       attempt with the connect timeout.</li>
 *   <li>Schedule reconnection after an unexpected close, spaced by the
 *       {@link BackoffPolicy} and capped by its attempt budget.</li>
 *   <li>Replay the {@link OutboundQueue} after every successful open.</li>
 *   <li>Write to the transport. Nothing else holds the endpoint.</li>
 * </ul>
 *
 * It does NOT decode frames or correlate responses: inbound text frames are
 * handed verbatim to the frame handler supplied at construction.
 *
 * <h2>Concurrency</h2>
 * Every state change happens under one monitor. Listener notifications,
 * observability events and endpoint start/stop calls are collected while the
 * monitor is held and run after it is released, so callbacks may call back
 * into the manager freely.
 *
 * <h2>Stale events</h2>
 * Each endpoint is tagged with a generation number. Opening, abandoning or
 * releasing an endpoint advances the generation; callbacks and timers
 * carrying an older generation are ignored.
 */
public final class ConnectionManager
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final MessageEndpointFactory endpointFactory;
    private final BridgeMessageCodec codec;
    private final PendingRequestTable pendingRequests;
    private final OutboundQueue outboundQueue;
    private final Consumer<String> inboundFrameHandler;
    private final Duration connectTimeout;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private final Set<ErrorListener> errorListeners = new CopyOnWriteArraySet<>();
    private final Set<ReconnectListener> reconnectListeners = new CopyOnWriteArraySet<>();

    private final Object lock = new Object();

    // Guarded by lock.
    private final ReconnectAttemptTracker attempts;
    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile long generation;
    private MessageEndpoint endpoint;
    private boolean endpointOpen;
    private boolean reconnectAttempt;
    private boolean flushing;
    private Cancellable connectTimer;
    private Cancellable backoffTimer;

    public ConnectionManager(MessageEndpointFactory endpointFactory,
                             BridgeMessageCodec codec,
                             PendingRequestTable pendingRequests,
                             OutboundQueue outboundQueue,
                             Consumer<String> inboundFrameHandler,
                             Duration connectTimeout,
                             BackoffPolicy backoffPolicy,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             WallClock wallClock,
                             BridgeObservabilitySink observabilitySink)
    {
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.pendingRequests = Objects.requireNonNull(pendingRequests, "pendingRequests");
        this.outboundQueue = Objects.requireNonNull(outboundQueue, "outboundQueue");
        this.inboundFrameHandler = Objects.requireNonNull(inboundFrameHandler, "inboundFrameHandler");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.attempts = new ReconnectAttemptTracker(Objects.requireNonNull(backoffPolicy, "backoffPolicy"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Open the connection, or join the attempt already in progress.
     *
     * <p>Completes immediately when connected. Fails with
     * {@link BridgeTimeoutException} if the transport does not open within
     * the connect timeout, or with {@link BridgeConnectionException} if it
     * closes first or {@link #disconnect()} intervenes.</p>
     */
    public CompletableFuture<Void> connect()
    {
        List<Runnable> after = new ArrayList<>();
        CompletableFuture<Void> waiter;

        synchronized (lock) {
            if (state == ConnectionState.CONNECTED) {
                return CompletableFuture.completedFuture(null);
            }

            waiter = new CompletableFuture<>();
            connectWaiters.add(waiter);

            // An attempt is already in flight: wait for it rather than opening a second transport.
            if (endpoint != null) {
                return waiter;
            }

            boolean resumingReconnect = state == ConnectionState.RECONNECTING;
            try {
                openAttempt(ConnectionState.CONNECTING, "connect requested", resumingReconnect, after);
            } catch (RuntimeException e) {
                connectWaiters.remove(waiter);
                throw e;
            }
            cancelBackoffTimer();
            attempts.reset();
        }

        runAll(after);
        return waiter;
    }

    /**
     * Close the connection and reject everything outstanding.
     *
     * <p>Cancels the connect and backoff timers, closes the endpoint,
     * fails connect waiters, rejects every pending request with
     * {@link BridgeConnectionException} and discards the outbound queue.
     * Safe to call in any state, any number of times.</p>
     */
    public void disconnect()
    {
        List<Runnable> after = new ArrayList<>();
        MessageEndpoint released;

        synchronized (lock) {
            cancelConnectTimer();
            cancelBackoffTimer();

            released = endpoint;
            releaseEndpoint();
            attempts.reset();
            reconnectAttempt = false;

            failConnectWaiters(new BridgeConnectionException("Connection closed"), after);
            transition(ConnectionState.DISCONNECTED, "disconnect requested", after);
        }

        if (released != null) {
            released.stop();
        }

        int rejected = pendingRequests.teardownAll(new BridgeConnectionException("Connection closed"));
        List<BridgeRequest> discarded = outboundQueue.drain();
        if (rejected > 0 || !discarded.isEmpty()) {
            log.debug("Disconnect rejected {} pending request(s), discarded {} queued", rejected, discarded.size());
        }

        runAll(after);
    }

    public ConnectionState state()
    {
        return state;
    }

    public boolean isConnected()
    {
        return state == ConnectionState.CONNECTED;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Write a request now if connected, otherwise queue it for replay.
     *
     * <p>Queuing from {@link ConnectionState#DISCONNECTED} also starts a
     * connection attempt. From {@link ConnectionState#FAILED} the request
     * waits for an explicit {@link #connect()} or its own timeout.</p>
     */
    public void transmit(BridgeRequest request)
    {
        Objects.requireNonNull(request, "request");

        MessageEndpoint target = null;
        boolean startConnect = false;
        boolean drainQueue = false;

        synchronized (lock) {
            if (state == ConnectionState.CONNECTED && endpointOpen) {
                if (outboundQueue.isEmpty() && !flushing) {
                    target = endpoint;
                } else {
                    // Keep behind requests still waiting for replay. A running
                    // flush picks this up before it lets go of the queue.
                    outboundQueue.enqueue(request);
                    drainQueue = !flushing;
                }
            } else {
                outboundQueue.enqueue(request);
                startConnect = state == ConnectionState.DISCONNECTED;
            }
        }

        if (target != null && !write(target, request)) {
            // Nothing reached the wire; the close that follows triggers replay.
            outboundQueue.enqueue(request);
        }
        if (drainQueue) {
            flushQueue();
        }
        if (startConnect) {
            connect().whenComplete((ignored, failure) -> {
                if (failure != null) {
                    log.debug("Connect triggered by queued request {} failed: {}",
                            request.correlationId(), failure.getMessage());
                }
            });
        }
    }

    private boolean write(MessageEndpoint target, BridgeRequest request)
    {
        String frame = codec.encode(request);
        if (!target.send(frame)) {
            return false;
        }
        observabilitySink.onWireEvent(new BridgeWireEvent(wallClock.now(), BridgeWireEvent.Direction.OUTBOUND, frame));
        return true;
    }

    /**
     * Drain the outbound queue in order. Only one thread flushes at a time;
     * requests transmitted meanwhile are queued behind the snapshot and the
     * flushing thread keeps going until the queue is empty.
     */
    private void flushQueue()
    {
        MessageEndpoint target;
        synchronized (lock) {
            if (flushing || state != ConnectionState.CONNECTED || !endpointOpen) {
                return;
            }
            flushing = true;
            target = endpoint;
        }

        try {
            while (true) {
                final MessageEndpoint current = target;
                OutboundQueue.FlushResult result = outboundQueue.flush(request -> {
                    // Already timed out or cancelled: nobody is waiting for the answer.
                    if (!pendingRequests.contains(request.correlationId())) {
                        return true;
                    }
                    return write(current, request);
                });

                if (!result.complete()) {
                    log.debug("Flush interrupted: {} sent, {} re-queued", result.consumed(), result.requeued());
                }

                synchronized (lock) {
                    boolean open = state == ConnectionState.CONNECTED && endpointOpen;
                    // A failed write on the same endpoint waits for the close that follows.
                    boolean stalled = !result.complete() && endpoint == current;
                    if (!open || stalled || outboundQueue.isEmpty()) {
                        flushing = false;
                        return;
                    }
                    target = endpoint;
                }
            }
        } catch (RuntimeException e) {
            synchronized (lock) {
                flushing = false;
            }
            throw e;
        }
    }

    // -------------------------------------------------------------------------
    // Listeners
    // -------------------------------------------------------------------------

    public void addErrorListener(ErrorListener listener)
    {
        errorListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeErrorListener(ErrorListener listener)
    {
        errorListeners.remove(listener);
    }

    public void addReconnectListener(ReconnectListener listener)
    {
        reconnectListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeReconnectListener(ReconnectListener listener)
    {
        reconnectListeners.remove(listener);
    }

    public void clearListeners()
    {
        errorListeners.clear();
        reconnectListeners.clear();
    }

    // -------------------------------------------------------------------------
    // Attempt handling (all called with lock held unless noted)
    // -------------------------------------------------------------------------

    private void openAttempt(ConnectionState attemptState, String reason, boolean isReconnect, List<Runnable> after)
    {
        MessageEndpoint created = endpointFactory.create();
        long attemptGeneration = ++generation;
        created.setListener(new EndpointEvents(attemptGeneration));

        endpoint = created;
        endpointOpen = false;
        reconnectAttempt = isReconnect;
        connectTimer = scheduler.scheduleAfter(connectTimeout, clock, () -> onConnectTimeout(attemptGeneration));

        transition(attemptState, reason, after);
        after.add(() -> startEndpoint(attemptGeneration, created));
    }

    // Runs without the lock.
    private void startEndpoint(long attemptGeneration, MessageEndpoint target)
    {
        try {
            target.start();
        } catch (RuntimeException e) {
            onTransportDown(attemptGeneration, e);
        }
    }

    private void onTransportUp(long attemptGeneration)
    {
        List<Runnable> after = new ArrayList<>();
        List<CompletableFuture<Void>> waiters;
        boolean reconnected;

        synchronized (lock) {
            if (attemptGeneration != generation || endpoint == null) {
                return;
            }

            cancelConnectTimer();
            endpointOpen = true;
            attempts.reset();
            reconnected = reconnectAttempt;
            reconnectAttempt = false;
            transition(ConnectionState.CONNECTED, reconnected ? "reconnected" : "transport open", after);

            waiters = new ArrayList<>(connectWaiters);
            connectWaiters.clear();
        }

        // Order: state event, waiters, replay, then reconnect listeners.
        runAll(after);
        waiters.forEach(waiter -> waiter.complete(null));
        flushQueue();
        if (reconnected) {
            notifyReconnected();
        }
    }

    private void onTransportDown(long attemptGeneration, Throwable cause)
    {
        List<Runnable> after = new ArrayList<>();

        synchronized (lock) {
            if (attemptGeneration != generation || endpoint == null) {
                return;
            }

            ConnectionState prior = state;
            boolean wasOpen = endpointOpen;
            cancelConnectTimer();
            releaseEndpoint();

            BridgeConnectionException failure = wasOpen
                    ? new BridgeConnectionException("Connection closed unexpectedly", cause)
                    : new BridgeConnectionException("Connection attempt failed", cause);
            failConnectWaiters(failure, after);
            if (prior == ConnectionState.CONNECTED) {
                after.add(() -> notifyError(failure));
            }

            scheduleRetryOrFail(wasOpen ? "transport closed" : "connect failed", after);
        }

        runAll(after);
    }

    private void onTransportError(long attemptGeneration, Throwable cause)
    {
        boolean open;
        synchronized (lock) {
            if (attemptGeneration != generation) {
                return;
            }
            open = endpointOpen;
        }

        if (open) {
            notifyError(new BridgeConnectionException("Transport error", cause));
        } else {
            observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Transport error while connecting", cause));
        }
    }

    private void onMessage(long attemptGeneration, String frame)
    {
        if (attemptGeneration != generation) {
            return;
        }
        observabilitySink.onWireEvent(new BridgeWireEvent(wallClock.now(), BridgeWireEvent.Direction.INBOUND, frame));
        inboundFrameHandler.accept(frame);
    }

    private void onConnectTimeout(long attemptGeneration)
    {
        List<Runnable> after = new ArrayList<>();
        MessageEndpoint abandoned;

        synchronized (lock) {
            if (attemptGeneration != generation || endpoint == null || endpointOpen) {
                return;
            }

            connectTimer = null;
            abandoned = endpoint;
            releaseEndpoint();

            failConnectWaiters(new BridgeTimeoutException("Connection attempt timed out", connectTimeout), after);
            scheduleRetryOrFail("connect timed out", after);
        }

        abandoned.stop();
        runAll(after);
    }

    private void onBackoffElapsed(long scheduledGeneration)
    {
        List<Runnable> after = new ArrayList<>();

        synchronized (lock) {
            if (scheduledGeneration != generation
                    || state != ConnectionState.RECONNECTING
                    || endpoint != null) {
                return;
            }

            backoffTimer = null;
            try {
                openAttempt(ConnectionState.RECONNECTING, "retrying", true, after);
            } catch (RuntimeException e) {
                log.warn("Could not create endpoint for reconnection attempt", e);
                scheduleRetryOrFail("endpoint creation failed", after);
            }
        }

        runAll(after);
    }

    private void scheduleRetryOrFail(String reason, List<Runnable> after)
    {
        if (attempts.exhausted()) {
            reconnectAttempt = false;
            transition(ConnectionState.FAILED, reason + ", retries exhausted", after);
            ExhaustedRetriesException exhausted = new ExhaustedRetriesException(attempts.attempts());
            after.add(() -> notifyError(exhausted));
            return;
        }

        Duration delay = attempts.recordAttempt();
        long scheduledGeneration = generation;
        backoffTimer = scheduler.scheduleAfter(delay, clock, () -> onBackoffElapsed(scheduledGeneration));
        transition(ConnectionState.RECONNECTING, reason + ", retry in " + delay.toMillis() + "ms", after);
    }

    private void releaseEndpoint()
    {
        endpoint = null;
        endpointOpen = false;
        generation++;
    }

    private void failConnectWaiters(Throwable cause, List<Runnable> after)
    {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        after.add(() -> waiters.forEach(waiter -> waiter.completeExceptionally(cause)));
    }

    private void cancelConnectTimer()
    {
        Cancellable timer = connectTimer;
        if (timer != null) {
            timer.cancel();
            connectTimer = null;
        }
    }

    private void cancelBackoffTimer()
    {
        Cancellable timer = backoffTimer;
        if (timer != null) {
            timer.cancel();
            backoffTimer = null;
        }
    }

    private void transition(ConnectionState next, String reason, List<Runnable> after)
    {
        ConnectionState prior = state;
        if (prior == next) {
            return;
        }
        state = next;

        ConnectionStateTransitionEvent event = new ConnectionStateTransitionEvent(
                wallClock.now(), prior, next, attempts.snapshot(), reason);
        after.add(() -> observabilitySink.onStateTransition(event));
    }

    // -------------------------------------------------------------------------
    // Notification (never called with the lock held)
    // -------------------------------------------------------------------------

    private void notifyError(BridgeException error)
    {
        observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), error.getMessage(), error.getCause()));
        for (ErrorListener listener : errorListeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Error listener failed", e));
            }
        }
    }

    private void notifyReconnected()
    {
        for (ReconnectListener listener : reconnectListeners) {
            try {
                listener.onReconnected();
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Reconnect listener failed", e));
            }
        }
    }

    private static void runAll(List<Runnable> tasks)
    {
        for (Runnable task : tasks) {
            task.run();
        }
    }

    private final class EndpointEvents implements MessageEndpointListener
    {
        private final long attemptGeneration;

        private EndpointEvents(long attemptGeneration)
        {
            this.attemptGeneration = attemptGeneration;
        }

        @Override
        public void onTransportUp()
        {
            ConnectionManager.this.onTransportUp(attemptGeneration);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            ConnectionManager.this.onTransportDown(attemptGeneration, cause);
        }

        @Override
        public void onTransportError(Throwable cause)
        {
            ConnectionManager.this.onTransportError(attemptGeneration, cause);
        }

        @Override
        public void onMessage(String frame)
        {
            ConnectionManager.this.onMessage(attemptGeneration, frame);
        }
    }
}
