package com.questrail.bridge.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * MessageKind
 * -----------------------------------------------------------------------------
 * Closed set of logical sub-protocols multiplexed over the bridge connection.
 *
 * <p>The kind appears as {@code type} on outbound requests and as the first
 * {@code :}-separated segment of the {@code type} on inbound broadcasts
 * (e.g. {@code terminal:output}). An inbound type that maps to no kind is
 * decoded as an {@link UnroutableMessage} rather than being dropped.</p>
 */
public enum MessageKind
{
    COMMAND("command"),
    FILE("file"),
    PERMISSION("permission"),
    SCREEN("screen"),
    LOG("log"),
    TERMINAL("terminal"),
    DISCOVERY("discovery"),
    APP_INSTALLATION("app-installation", "app");

    private final String wireName;
    private final String broadcastPrefix;

    MessageKind(String wireName) {
        this(wireName, wireName);
    }

    MessageKind(String wireName, String broadcastPrefix) {
        this.wireName = wireName;
        this.broadcastPrefix = broadcastPrefix;
    }

    /**
     * Name used in the {@code type} field of outbound requests.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve an exact wire name.
     */
    public static Optional<MessageKind> fromWireName(String wireName) {
        Objects.requireNonNull(wireName, "wireName");
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the kind of an inbound broadcast from its topic. Accepts both a
     * bare kind ({@code screen}) and a qualified topic ({@code screen:frame}).
     */
    public static Optional<MessageKind> fromTopic(String topic) {
        Objects.requireNonNull(topic, "topic");
        int colon = topic.indexOf(':');
        String prefix = colon < 0 ? topic : topic.substring(0, colon);

        for (MessageKind kind : values()) {
            if (kind.wireName.equals(prefix) || kind.broadcastPrefix.equals(prefix)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
