package com.questrail.ircproxy.transport;

/**
 * Receives connections accepted by a {@link StreamTransport}.
 */
@FunctionalInterface
public interface StreamAcceptor
{
    /**
     * Called once per accepted connection, with reading paused.
     */
    void onAccepted(StreamEndpoint endpoint);
}
