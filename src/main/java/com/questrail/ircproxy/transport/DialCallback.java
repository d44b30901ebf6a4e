package com.questrail.ircproxy.transport;

/**
 * Outcome of {@link StreamTransport#dial}.
 */
public interface DialCallback
{
    /**
     * The outbound connection is established, with reading paused.
     */
    void onConnected(StreamEndpoint endpoint);

    void onFailed(Throwable cause);
}
