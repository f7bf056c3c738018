package com.questrail.bridge.transport;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link MessageEndpoint}.
 *
 * <p>Implementations deliver callbacks serially. Netty-backed endpoints
 * deliver them on the channel's event loop.</p>
 */
public interface MessageEndpointListener
{
    /**
     * The connection is open and frames may be written.
     */
    void onTransportUp();

    /**
     * The connection is closed, or never opened. Delivered at most once.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * A transport error occurred. The connection may still be open; if it
     * is not, {@link #onTransportDown(Throwable)} follows.
     */
    void onTransportError(Throwable cause);

    /**
     * One complete inbound text frame, exactly as received.
     */
    void onMessage(String frame);
}
