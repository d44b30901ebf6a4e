package com.questrail.ircproxy.transport;

import java.net.InetSocketAddress;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Listener and dialer for byte-stream connections.
 *
 * <p>The transport accepts downstream (client) connections and opens the
 * matching upstream (server) connections. It knows nothing about IRC.</p>
 */
public interface StreamTransport
{
    /**
     * Bind the listen address and begin accepting connections.
     *
     * @return the address actually bound (useful when binding port 0)
     * @throws IllegalStateException if the address cannot be bound
     */
    InetSocketAddress start(InetSocketAddress listenAddress, StreamAcceptor acceptor);

    /**
     * Open an outbound connection on behalf of {@code origin}.
     *
     * <p>Implementations should deliver the new endpoint's callbacks on the
     * same thread as {@code origin}'s, so that both legs of a relay share one
     * execution context. The callback runs on that thread too.</p>
     */
    void dial(StreamEndpoint origin, InetSocketAddress target, DialCallback callback);

    /**
     * Stop accepting, close every connection and release all resources.
     */
    void stop();

    /**
     * Block until the listener has closed.
     */
    void awaitTermination() throws InterruptedException;
}
