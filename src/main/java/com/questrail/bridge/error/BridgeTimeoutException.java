package com.questrail.bridge.error;

import java.time.Duration;

/**
 * A connect attempt or a single request did not complete within its window.
 */
public final class BridgeTimeoutException extends BridgeException
{
    private final Duration timeout;

    public BridgeTimeoutException(String message, Duration timeout) {
        super(message + " after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
