package com.questrail.ircproxy.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation. Netty endpoints deliver them on the channel's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called with bytes exactly as received. Chunk boundaries carry no
     * meaning; the payload is not a message.
     */
    void onBytes(byte[] payload);

    /**
     * Called when the outbound buffer crosses its high or low water mark.
     *
     * @param writable false while the endpoint is backed up
     */
    void onWritabilityChanged(boolean writable);

    /**
     * Called once when the stream is gone, for whatever reason.
     *
     * @param cause the transport fault, or {@code null} for an orderly close
     */
    void onDisconnected(Throwable cause);
}
