package com.questrail.bridge.internal.exec;

import com.questrail.bridge.error.BridgeProtocolException;
import com.questrail.bridge.error.BridgeTimeoutException;
import com.questrail.bridge.internal.time.Cancellable;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.MonotonicScheduler;
import com.questrail.bridge.protocol.BridgeResponse;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PendingRequestTable
 * =============================================================================
 * Registry of requests awaiting a correlated response.
 *
 * <h2>Settlement</h2>
 * Each entry settles exactly once, by whichever of these wins the atomic
 * removal from the map:
 * <ul>
 *   <li>a matching response ({@link #settle})</li>
 *   <li>its timeout firing</li>
 *   <li>the caller cancelling the returned future</li>
 *   <li>{@link #teardownAll}</li>
 * </ul>
 * The loser finds the entry gone and does nothing. Every path that removes an
 * entry also cancels its timer.
 *
 * <h2>Cancellation</h2>
 * Cancelling the returned future abandons the request locally. Nothing is
 * sent to the remote side; any work it already started continues.
 *
 * <h2>Thread Safety</h2>
 * Registration and settlement may happen concurrently from caller threads,
 * the transport event loop and the scheduler thread.
 */
public final class PendingRequestTable {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    private final ConcurrentMap<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public PendingRequestTable(MonotonicClock clock, MonotonicScheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Register a request and arm its timeout.
     *
     * @return future completed with the successful response, or failed with
     *         {@link BridgeTimeoutException}, {@link BridgeProtocolException}
     *         or the teardown cause
     * @throws IllegalStateException if {@code correlationId} is still in flight
     */
    public CompletableFuture<BridgeResponse> register(String correlationId, Duration timeout) {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(timeout, "timeout");

        PendingRequest entry = new PendingRequest(correlationId, clock.nowNanos());
        if (pending.putIfAbsent(correlationId, entry) != null) {
            throw new IllegalStateException("Correlation id already in flight: " + correlationId);
        }

        entry.timeoutHandle = scheduler.scheduleAfter(timeout, clock, () -> expire(entry, timeout));
        // Settled or torn down before the handle was visible: the timer is ours to cancel.
        if (pending.get(correlationId) != entry) {
            entry.cancelTimer();
        }

        // A future cancelled by the caller releases its slot immediately.
        entry.future.whenComplete((response, failure) -> {
            if (entry.future.isCancelled()) {
                release(entry);
            }
        });

        return entry.future;
    }

    /**
     * Route a response to its waiter.
     *
     * @return {@code true} if a waiter was found; {@code false} for late or
     *         duplicate responses, which are discarded
     */
    public boolean settle(BridgeResponse response) {
        Objects.requireNonNull(response, "response");

        PendingRequest entry = pending.remove(response.correlationId());
        if (entry == null) {
            return false;
        }

        entry.cancelTimer();
        if (response.success()) {
            entry.future.complete(response);
        } else {
            entry.future.completeExceptionally(
                    new BridgeProtocolException(response.correlationId(), response.error()));
        }
        return true;
    }

    /**
     * Fail and remove a single entry, for requests that never left the client.
     *
     * @return {@code true} if the entry was still pending
     */
    public boolean fail(String correlationId, Throwable cause) {
        Objects.requireNonNull(cause, "cause");

        PendingRequest entry = pending.remove(correlationId);
        if (entry == null) {
            return false;
        }
        entry.cancelTimer();
        entry.future.completeExceptionally(cause);
        return true;
    }

    /**
     * Fail and remove every outstanding entry.
     *
     * @return number of entries failed
     */
    public int teardownAll(Throwable cause) {
        Objects.requireNonNull(cause, "cause");

        int failed = 0;
        for (PendingRequest entry : pending.values()) {
            if (pending.remove(entry.correlationId, entry)) {
                entry.cancelTimer();
                entry.future.completeExceptionally(cause);
                failed++;
            }
        }
        return failed;
    }

    public boolean contains(String correlationId) {
        return pending.containsKey(correlationId);
    }

    public int size() {
        return pending.size();
    }

    /**
     * Nanoseconds the given request has been waiting, or -1 if not pending.
     */
    public long ageNanos(String correlationId) {
        PendingRequest entry = pending.get(correlationId);
        return entry == null ? -1L : clock.nowNanos() - entry.createdAtNanos;
    }

    private void expire(PendingRequest entry, Duration timeout) {
        if (pending.remove(entry.correlationId, entry)) {
            entry.future.completeExceptionally(
                    new BridgeTimeoutException("Request " + entry.correlationId + " timed out", timeout));
        }
    }

    private void release(PendingRequest entry) {
        if (pending.remove(entry.correlationId, entry)) {
            entry.cancelTimer();
        }
    }

    private static final class PendingRequest {
        private final String correlationId;
        private final long createdAtNanos;
        private final CompletableFuture<BridgeResponse> future = new CompletableFuture<>();
        private volatile Cancellable timeoutHandle;

        private PendingRequest(String correlationId, long createdAtNanos) {
            this.correlationId = correlationId;
            this.createdAtNanos = createdAtNanos;
        }

        private void cancelTimer() {
            Cancellable handle = timeoutHandle;
            if (handle != null) {
                handle.cancel();
            }
        }
    }
}
