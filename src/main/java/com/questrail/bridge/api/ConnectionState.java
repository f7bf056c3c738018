package com.questrail.bridge.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle of the single bridge connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED
 *                      ↑            │ (unexpected close)
 *                      │            ↓
 *                      └──────  RECONNECTING ──(retries exhausted)──→ FAILED
 * </pre>
 *
 * <p>{@link #DISCONNECTED} and {@link #FAILED} are resting states; only an
 * explicit {@code connect()} leaves them. {@code disconnect()} returns to
 * {@link #DISCONNECTED} from anywhere.</p>
 */
public enum ConnectionState
{
    /** No transport and no retry scheduled. Initial state. */
    DISCONNECTED,

    /** A transport is being opened and has not reported open yet. */
    CONNECTING,

    /** The transport is open; requests are written immediately. */
    CONNECTED,

    /**
     * The connection dropped; a retry is scheduled or in progress. Requests
     * are queued until it succeeds.
     */
    RECONNECTING,

    /**
     * Automatic reconnection gave up. Requests stay queued until an explicit
     * {@code connect()} or their timeout.
     */
    FAILED;

    public boolean isResting() {
        return this == DISCONNECTED || this == FAILED;
    }
}
