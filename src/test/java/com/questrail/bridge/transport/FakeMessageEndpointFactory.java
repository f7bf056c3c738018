package com.questrail.bridge.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * FakeMessageEndpointFactory
 * -----------------------------------------------------------------------------
 * Test-only transport. Every {@link #create()} returns a new
 * {@link FakeEndpoint} that stays "connecting" until the test calls
 * {@link FakeEndpoint#open()} (or immediately, with {@link #autoOpen}).
 *
 * <p>Contains no bridge semantics: it stores outbound frames and lets tests
 * inject inbound frames and lifecycle events.</p>
 */
public final class FakeMessageEndpointFactory implements MessageEndpointFactory {

    private final List<FakeEndpoint> endpoints = new ArrayList<>();
    private volatile boolean autoOpen;
    private volatile boolean closed;

    public FakeMessageEndpointFactory autoOpen(boolean autoOpen) {
        this.autoOpen = autoOpen;
        return this;
    }

    @Override
    public synchronized MessageEndpoint create() {
        if (closed) {
            throw new IllegalStateException("factory closed");
        }
        FakeEndpoint endpoint = new FakeEndpoint(autoOpen);
        endpoints.add(endpoint);
        return endpoint;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized List<FakeEndpoint> endpoints() {
        return Collections.unmodifiableList(new ArrayList<>(endpoints));
    }

    public synchronized int createdCount() {
        return endpoints.size();
    }

    public synchronized FakeEndpoint latest() {
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("No endpoint created yet");
        }
        return endpoints.get(endpoints.size() - 1);
    }

    /**
     * Frames written to every endpoint, in creation then write order.
     */
    public synchronized List<String> allSentFrames() {
        List<String> frames = new ArrayList<>();
        endpoints.forEach(e -> frames.addAll(e.sent()));
        return frames;
    }

    public static final class FakeEndpoint implements MessageEndpoint {

        private final boolean autoOpen;
        private final List<String> sent = new ArrayList<>();
        private MessageEndpointListener listener;
        private boolean started;
        private boolean stopped;
        private boolean open;
        private boolean downReported;
        private boolean failWrites;
        private volatile Consumer<String> beforeWrite = frame -> { };

        private FakeEndpoint(boolean autoOpen) {
            this.autoOpen = autoOpen;
        }

        @Override
        public void setListener(MessageEndpointListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        @Override
        public void start() {
            started = true;
            if (autoOpen) {
                open();
            }
        }

        @Override
        public void stop() {
            stopped = true;
            reportDown(null);
        }

        @Override
        public boolean send(String frame) {
            Objects.requireNonNull(frame, "frame");
            beforeWrite.accept(frame);
            synchronized (this) {
                if (!open || failWrites) {
                    return false;
                }
                sent.add(frame);
                return true;
            }
        }

        // ---------------------------------------------------------------------
        // Test helpers
        // ---------------------------------------------------------------------

        public void open() {
            open = true;
            requireListener().onTransportUp();
        }

        /**
         * Simulate the remote side closing, or the attempt failing.
         */
        public void drop(Throwable cause) {
            reportDown(cause);
        }

        public void fail(Throwable cause) {
            requireListener().onTransportError(cause);
        }

        public void inject(String frame) {
            requireListener().onMessage(frame);
        }

        /**
         * Run {@code hook} on the writing thread before each frame is recorded.
         */
        public void beforeWrite(Consumer<String> hook) {
            this.beforeWrite = Objects.requireNonNull(hook, "hook");
        }

        public void failWrites(boolean failWrites) {
            this.failWrites = failWrites;
        }

        public synchronized List<String> sent() {
            return Collections.unmodifiableList(new ArrayList<>(sent));
        }

        public boolean isStarted() {
            return started;
        }

        public boolean isStopped() {
            return stopped;
        }

        public boolean isOpen() {
            return open;
        }

        private void reportDown(Throwable cause) {
            open = false;
            if (!downReported) {
                downReported = true;
                if (listener != null) {
                    listener.onTransportDown(cause);
                }
            }
        }

        private MessageEndpointListener requireListener() {
            if (listener == null) {
                throw new IllegalStateException("No listener installed");
            }
            return listener;
        }
    }
}
