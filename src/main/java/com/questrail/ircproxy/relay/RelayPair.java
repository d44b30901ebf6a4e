package com.questrail.ircproxy.relay;

import com.questrail.ircproxy.model.IrcMessage;
import com.questrail.ircproxy.observability.RelayObservabilitySink;
import com.questrail.ircproxy.observability.RelayProtocolEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * RelayPair
 * =============================================================================
 * Couples a downstream (client-facing) and an upstream (server-facing)
 * {@link ConnectionChannel}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Forward every decoded message, unmodified and in decode order, to the
 *       opposite channel's send path</li>
 *   <li>After forwarding a QUIT from downstream, close both channels once
 *       their writes are flushed</li>
 *   <li>When either channel closes, close the other after flushing, so no
 *       half-open pair survives</li>
 *   <li>Stop reading from a channel while the opposite channel cannot keep up
 *       with writes</li>
 *   <li>Optionally, when one channel switches to JSON receive mode, switch the
 *       opposite channel's send side too</li>
 * </ul>
 *
 * <p>The pair does not decode, encode or interpret anything beyond QUIT.
 * STARTJSON never reaches it; the channel consumes it.</p>
 */
public final class RelayPair implements ConnectionChannel.Listener
{
    public static final String QUIT = "quit";

    private final ConnectionChannel downstream;
    private final ConnectionChannel upstream;
    private final RelayObservabilitySink sink;
    private final boolean propagateFormatSwitch;

    public RelayPair(ConnectionChannel downstream,
                     ConnectionChannel upstream,
                     RelayObservabilitySink sink,
                     boolean propagateFormatSwitch) {

        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.propagateFormatSwitch = propagateFormatSwitch;

        if (downstream == upstream) {
            throw new IllegalArgumentException("downstream and upstream must be distinct channels");
        }

        downstream.bind(this, upstream);
        upstream.bind(this, downstream);
    }

    /**
     * Begin reading on both legs.
     */
    public void open()
    {
        upstream.open();
        downstream.open();
    }

    public ConnectionChannel downstream()
    {
        return downstream;
    }

    public ConnectionChannel upstream()
    {
        return upstream;
    }

    @Override
    public void onMessage(ConnectionChannel source, IrcMessage message)
    {
        source.peer().send(message);

        if (source == downstream && message.command().is(QUIT)) {
            sink.onProtocolEvent(new RelayProtocolEvent(
                    Instant.now(), source.id(), RelayProtocolEvent.Kind.QUIT_OBSERVED));
            upstream.closeAfterWriting();
            downstream.closeAfterWriting();
        }
    }

    @Override
    public void onReceiveFormatSwitched(ConnectionChannel source)
    {
        if (propagateFormatSwitch) {
            source.peer().enterJsonSendMode();
        }
    }

    @Override
    public void onWritabilityChanged(ConnectionChannel source, boolean writable)
    {
        source.peer().setReading(writable);
    }

    @Override
    public void onClosed(ConnectionChannel source, Throwable cause)
    {
        source.peer().closeAfterWriting();
    }
}
