package com.questrail.bridge.transport;

/**
 * Creates a fresh {@link MessageEndpoint} per connection attempt and owns
 * whatever the endpoints share (event loops, TLS context).
 */
public interface MessageEndpointFactory extends AutoCloseable
{
    MessageEndpoint create();

    /**
     * Release shared resources. Endpoints created earlier must not be used
     * afterwards.
     */
    @Override
    void close();
}
