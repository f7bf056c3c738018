package com.questrail.bridge.internal.exec;

import com.questrail.bridge.protocol.BridgeRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * OutboundQueue
 * =============================================================================
 * Unbounded FIFO of requests waiting for a live connection.
 *
 * <h2>Flush generations</h2>
 * {@link #flush} snapshots and clears the queue under the lock, then drains
 * the snapshot outside it. Requests enqueued while a flush is draining land
 * in the emptied queue and go out with the next flush, never ahead of the
 * snapshot.
 *
 * <h2>Partial flush</h2>
 * If the sender reports that a request could not be written (the connection
 * dropped mid-flush), that request and the rest of the snapshot are put back
 * at the head of the queue, ahead of anything enqueued meanwhile. Requests
 * already handed to the transport are not re-queued.
 */
public final class OutboundQueue {

    /**
     * Receives queued requests during a flush.
     */
    @FunctionalInterface
    public interface Sender {
        /**
         * @return {@code true} if the request was consumed (written, or
         *         deliberately discarded); {@code false} if it could not be
         *         written and must stay queued
         */
        boolean offer(BridgeRequest request);
    }

    /**
     * Outcome of one flush.
     *
     * @param consumed requests the sender accepted
     * @param requeued requests put back at the head of the queue
     */
    public record FlushResult(int consumed, int requeued) {
        public boolean complete() {
            return requeued == 0;
        }
    }

    private final Deque<BridgeRequest> entries = new ArrayDeque<>();

    public synchronized void enqueue(BridgeRequest request) {
        entries.addLast(Objects.requireNonNull(request, "request"));
    }

    public FlushResult flush(Sender sender) {
        Objects.requireNonNull(sender, "sender");

        final List<BridgeRequest> snapshot;
        synchronized (this) {
            if (entries.isEmpty()) {
                return new FlushResult(0, 0);
            }
            snapshot = new ArrayList<>(entries);
            entries.clear();
        }

        for (int i = 0; i < snapshot.size(); i++) {
            if (!sender.offer(snapshot.get(i))) {
                List<BridgeRequest> remaining = snapshot.subList(i, snapshot.size());
                requeueAtHead(remaining);
                return new FlushResult(i, remaining.size());
            }
        }
        return new FlushResult(snapshot.size(), 0);
    }

    /**
     * Remove and return everything queued, in order.
     */
    public synchronized List<BridgeRequest> drain() {
        List<BridgeRequest> drained = new ArrayList<>(entries);
        entries.clear();
        return drained;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    private synchronized void requeueAtHead(List<BridgeRequest> remaining) {
        for (int i = remaining.size() - 1; i >= 0; i--) {
            entries.addFirst(remaining.get(i));
        }
    }
}
