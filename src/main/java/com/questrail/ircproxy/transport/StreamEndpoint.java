package com.questrail.ircproxy.transport;

import java.net.SocketAddress;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one connected byte stream (one leg of a relay).
 *
 * <p>Endpoints start with reading paused. Higher layers install a listener,
 * then call {@link #setReading(boolean)} to begin receiving, so that no bytes
 * can arrive before something is ready to decode them.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.
 * All calls for one endpoint, and all callbacks it delivers, happen on one
 * thread at a time.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     *
     * <p>If the endpoint has already disconnected, the listener is notified
     * immediately.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Queue bytes for transmission. Writes after close are dropped.
     */
    void write(byte[] payload);

    /**
     * Pause or resume delivery of inbound bytes.
     */
    void setReading(boolean reading);

    /**
     * Close once every queued write has been flushed.
     */
    void closeAfterWriting();

    /**
     * Close immediately, discarding queued writes.
     */
    void close();

    /**
     * @return the remote peer, or {@code null} if unknown
     */
    SocketAddress remoteAddress();
}
