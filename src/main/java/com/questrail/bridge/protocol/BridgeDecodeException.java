package com.questrail.bridge.protocol;

/**
 * An inbound text frame could not be turned into an {@link InboundMessage}.
 *
 * <p>Typical causes:</p>
 * <ul>
 *   <li>Malformed JSON</li>
 *   <li>A JSON value that is not an object</li>
 *   <li>An object that is neither a response nor a typed broadcast</li>
 * </ul>
 *
 * <p>Decode failures are transport defects: the frame is dropped and
 * reported, never turned into a request failure.</p>
 */
public final class BridgeDecodeException extends RuntimeException
{
    public BridgeDecodeException(String message) {
        super(message);
    }

    public BridgeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
