package com.questrail.bridge.error;

/**
 * BridgeException
 * -----------------------------------------------------------------------------
 * Root of the bridge client's error taxonomy.
 *
 * <p>Two delivery paths exist and each subtype belongs to exactly one:</p>
 * <ul>
 *   <li>{@link BridgeTimeoutException} and {@link BridgeProtocolException}
 *       fail the one request future that triggered them.</li>
 *   <li>{@link BridgeConnectionException} and {@link ExhaustedRetriesException}
 *       are not tied to a caller and are delivered to registered error
 *       listeners. {@link BridgeConnectionException} additionally fails
 *       pending requests on explicit teardown.</li>
 * </ul>
 */
public abstract class BridgeException extends RuntimeException
{
    protected BridgeException(String message) {
        super(message);
    }

    protected BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
