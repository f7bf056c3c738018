package com.questrail.bridge.transport;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * One message-framed, bidirectional connection attempt.
 *
 * <p>An endpoint is used for exactly one open/close cycle. Reconnecting means
 * asking the {@link MessageEndpointFactory} for a new endpoint, so events
 * from a dead connection can never be confused with the live one.</p>
 *
 * <p>Implementations may be backed by Netty, the JDK HTTP client, or a test
 * fake.</p>
 */
public interface MessageEndpoint
{
    /**
     * Register the listener that receives frames and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(MessageEndpointListener listener);

    /**
     * Begin opening the connection. Returns without waiting.
     *
     * <p>The listener later receives exactly one of
     * {@link MessageEndpointListener#onTransportUp()} or
     * {@link MessageEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the connection and release its resources.
     *
     * <p>If the endpoint had not already reported down, the listener receives
     * {@link MessageEndpointListener#onTransportDown(Throwable)} once.</p>
     */
    void stop();

    /**
     * Write one text frame.
     *
     * @return {@code false} if the endpoint is not open and nothing was
     *         written; the caller decides what to do with the frame
     */
    boolean send(String frame);
}
