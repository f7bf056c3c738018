package com.questrail.bridge.transport.websocket.netty;

import com.questrail.bridge.config.BridgeEndpointConfig;
import com.questrail.bridge.transport.MessageEndpoint;
import com.questrail.bridge.transport.MessageEndpointFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyWebSocketEndpointFactory
 * =============================================================================
 * Creates one {@link NettyWebSocketEndpoint} per connection attempt, all
 * sharing a single event loop and (for {@code wss}) one TLS context.
 *
 * <p>By default a dedicated single-thread {@link NioEventLoopGroup} is
 * created and shut down by {@link #close()}. A caller-supplied group is left
 * running.</p>
 */
public final class NettyWebSocketEndpointFactory implements MessageEndpointFactory
{
    private final URI uri;
    private final int maxFramePayloadLength;
    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final SslContext sslContext;

    public NettyWebSocketEndpointFactory(BridgeEndpointConfig endpoint, int maxFramePayloadLength)
    {
        this(endpoint, maxFramePayloadLength,
                new NioEventLoopGroup(1, new DefaultThreadFactory("device-bridge-io", true)), true);
    }

    public NettyWebSocketEndpointFactory(BridgeEndpointConfig endpoint, int maxFramePayloadLength, EventLoopGroup group)
    {
        this(endpoint, maxFramePayloadLength, group, false);
    }

    private NettyWebSocketEndpointFactory(BridgeEndpointConfig endpoint,
                                          int maxFramePayloadLength,
                                          EventLoopGroup group,
                                          boolean ownsGroup)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        this.uri = endpoint.toUri();
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.sslContext = endpoint.secure() ? clientSslContext() : null;
    }

    @Override
    public MessageEndpoint create()
    {
        if (group.isShuttingDown()) {
            throw new IllegalStateException("Endpoint factory is closed");
        }
        return new NettyWebSocketEndpoint(group, uri, sslContext, maxFramePayloadLength);
    }

    @Override
    public void close()
    {
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    private static SslContext clientSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to initialise TLS for wss endpoint", e);
        }
    }
}
