package com.questrail.bridge.error;

import java.util.Optional;

/**
 * The remote endpoint answered a request with {@code success=false}, or
 * answered with a document the operation could not read.
 *
 * <p>The message is the remote {@code error} string verbatim when one was
 * sent, otherwise a fallback naming the operation. {@link #correlationId()}
 * names the request that failed.</p>
 */
public final class BridgeProtocolException extends BridgeException
{
    private static final String DEFAULT_MESSAGE = "Request failed";

    private final String correlationId;
    private final String remoteError;

    public BridgeProtocolException(String correlationId, String remoteError) {
        this(correlationId, remoteError, DEFAULT_MESSAGE);
    }

    public BridgeProtocolException(String correlationId, String remoteError, String fallbackMessage) {
        super(remoteError != null ? remoteError : fallbackMessage);
        this.correlationId = correlationId;
        this.remoteError = remoteError;
    }

    /**
     * A successful response whose {@code data} did not have the expected shape.
     */
    public BridgeProtocolException(String correlationId, String message, Throwable cause) {
        super(message, cause);
        this.correlationId = correlationId;
        this.remoteError = null;
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * The {@code error} text sent by the remote side, if any.
     */
    public Optional<String> remoteError() {
        return Optional.ofNullable(remoteError);
    }
}
