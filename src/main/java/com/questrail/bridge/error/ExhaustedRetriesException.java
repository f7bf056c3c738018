package com.questrail.bridge.error;

/**
 * Automatic reconnection gave up after the configured number of attempts.
 * Fired once per exhaustion; a fresh {@code connect()} starts over.
 */
public final class ExhaustedRetriesException extends BridgeException
{
    private final int attempts;

    public ExhaustedRetriesException(int attempts) {
        super("Max reconnection attempts reached (" + attempts + ")");
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
