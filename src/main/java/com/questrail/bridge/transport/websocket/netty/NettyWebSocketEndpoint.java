package com.questrail.bridge.transport.websocket.netty;

import com.questrail.bridge.transport.MessageEndpoint;
import com.questrail.bridge.transport.MessageEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link MessageEndpoint} port: one
 * WebSocket client connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse JSON or interpret envelopes</li>
 *   <li>Correlate responses or queue requests</li>
 *   <li>Schedule reconnection or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound text frames are handed to the
 * listener as {@code String}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects the socket and performs the WebSocket handshake;
 *   the listener hears {@code onTransportUp} only once the handshake completes.
 * - {@link #stop()} sends a close frame (when open) and closes the channel.
 * - Down is reported at most once, whichever of connect failure, handshake
 *   failure, remote close or {@link #stop()} happens first.
 */
public final class NettyWebSocketEndpoint implements MessageEndpoint
{
    private static final int HANDSHAKE_RESPONSE_MAX_BYTES = 8192;

    private final EventLoopGroup group;
    private final URI uri;
    private final SslContext sslContext;
    private final int maxFramePayloadLength;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean downReported = new AtomicBoolean(false);

    private volatile MessageEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean open;

    /**
     * @param sslContext TLS context for {@code wss}; {@code null} for {@code ws}
     */
    NettyWebSocketEndpoint(EventLoopGroup group, URI uri, SslContext sslContext, int maxFramePayloadLength)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.sslContext = sslContext;
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("NettyWebSocketEndpoint is single-use; create a new one to reconnect");
        }

        // A fresh handshaker per connection: it carries per-channel handshake state.
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), maxFramePayloadLength);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), uri.getPort()));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(HANDSHAKE_RESPONSE_MAX_BYTES));
                        p.addLast(new WebSocketFrameAggregator(maxFramePayloadLength));
                        p.addLast(new InboundHandler(handshaker));
                    }
                });

        ChannelFuture f = bootstrap.connect(uri.getHost(), uri.getPort());
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            if (open) {
                ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
            }
            else {
                ch.close();
            }
        }
        reportDown(null);
    }

    @Override
    public boolean send(String frame)
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (!open || ch == null || !ch.isActive()) {
            return false;
        }

        ch.writeAndFlush(new TextWebSocketFrame(frame)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                MessageEndpointListener l = listener;
                if (l != null) {
                    l.onTransportError(future.cause());
                }
            }
        });
        return true;
    }

    private MessageEndpointListener requireListener()
    {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
        return l;
    }

    private void reportDown(Throwable cause)
    {
        open = false;
        if (downReported.compareAndSet(false, true)) {
            MessageEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Completes the client handshake, then forwards text frames as strings.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private volatile Throwable lastError;

        private InboundHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ctx.channel(), response);
                    } catch (WebSocketHandshakeException e) {
                        lastError = e;
                        ctx.close();
                        return;
                    }
                    open = true;
                    requireListener().onTransportUp();
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException(
                        "Unexpected HTTP response after handshake (status=" + response.status() + ")");
            }

            if (msg instanceof TextWebSocketFrame text) {
                requireListener().onMessage(text.text());
            }
            else if (msg instanceof PingWebSocketFrame ping) {
                ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame) {
                ctx.close();
            }
            // Binary and pong frames carry nothing for this protocol.
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(lastError);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            lastError = cause;
            MessageEndpointListener l = listener;
            if (l != null) {
                l.onTransportError(cause);
            }
            ctx.close();
        }
    }
}
