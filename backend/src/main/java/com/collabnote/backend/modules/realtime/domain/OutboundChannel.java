package com.collabnote.backend.modules.realtime.domain;

import java.io.IOException;

/**
 * Transport side of a client connection. Calls are serialized per connection.
 */
public interface OutboundChannel {

    void send(String payload) throws IOException;

    boolean isOpen();

    /**
     * Tears down the underlying transport. Channels without one have nothing to release.
     */
    default void close() throws IOException {
    }
}
