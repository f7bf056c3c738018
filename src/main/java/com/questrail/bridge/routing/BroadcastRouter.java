package com.questrail.bridge.routing;

import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.protocol.BridgeBroadcast;
import com.questrail.bridge.protocol.MessageKind;
import com.questrail.bridge.protocol.UnroutableMessage;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * BroadcastRouter
 * =============================================================================
 * Fans unsolicited inbound messages out to subscribers, keyed by
 * {@link MessageKind}.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>Synchronous, on the thread that decoded the frame.</li>
 *   <li>A listener that throws is reported to the observability sink;
 *       delivery to the remaining listeners continues.</li>
 *   <li>Subscribing or unsubscribing during delivery is safe; the change
 *       applies from the next message.</li>
 * </ul>
 *
 * <h2>Unroutable messages</h2>
 * A message whose type maps to no kind is never dropped silently: it is
 * reported to the sink and handed to any {@link UnroutedListener}s.
 */
public final class BroadcastRouter
{
    private final Map<MessageKind, Set<BroadcastListener>> subscribers = new EnumMap<>(MessageKind.class);
    private final Set<UnroutedListener> unroutedListeners = new CopyOnWriteArraySet<>();
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public BroadcastRouter(BridgeObservabilitySink observabilitySink, WallClock wallClock)
    {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        // Populated once up front so the map itself is never mutated afterwards.
        for (MessageKind kind : MessageKind.values()) {
            subscribers.put(kind, new CopyOnWriteArraySet<>());
        }
    }

    public void subscribe(MessageKind kind, BroadcastListener listener)
    {
        Objects.requireNonNull(kind, "kind");
        subscribers.get(kind).add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @return {@code true} if the listener was subscribed to {@code kind}
     */
    public boolean unsubscribe(MessageKind kind, BroadcastListener listener)
    {
        Objects.requireNonNull(kind, "kind");
        return subscribers.get(kind).remove(listener);
    }

    public void addUnroutedListener(UnroutedListener listener)
    {
        unroutedListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeUnroutedListener(UnroutedListener listener)
    {
        unroutedListeners.remove(listener);
    }

    public int subscriberCount(MessageKind kind)
    {
        return subscribers.get(Objects.requireNonNull(kind, "kind")).size();
    }

    public void clear()
    {
        subscribers.values().forEach(Set::clear);
        unroutedListeners.clear();
    }

    /**
     * Deliver a broadcast to every listener of its kind.
     *
     * @return number of listeners that handled it without throwing
     */
    public int dispatch(BridgeBroadcast broadcast)
    {
        Objects.requireNonNull(broadcast, "broadcast");

        int delivered = 0;
        for (BroadcastListener listener : subscribers.get(broadcast.kind())) {
            try {
                listener.onBroadcast(broadcast);
                delivered++;
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(
                        wallClock.now(), "Broadcast listener failed for " + broadcast.topic(), e));
            }
        }
        return delivered;
    }

    public void dispatchUnrouted(UnroutableMessage message)
    {
        Objects.requireNonNull(message, "message");

        observabilitySink.onError(new BridgeErrorEvent(
                wallClock.now(), "Unroutable inbound message type '" + message.type() + "'", null));

        for (UnroutedListener listener : unroutedListeners) {
            try {
                listener.onUnrouted(message);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(
                        wallClock.now(), "Unrouted listener failed for " + message.type(), e));
            }
        }
    }
}
