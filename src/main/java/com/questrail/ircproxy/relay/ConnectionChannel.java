package com.questrail.ircproxy.relay;

import com.questrail.ircproxy.codec.IrcDecodeException;
import com.questrail.ircproxy.codec.IrcEncodeException;
import com.questrail.ircproxy.codec.IrcMessageEncoder;
import com.questrail.ircproxy.codec.IrcStreamDecoder;
import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.codec.impl.JsonCodec;
import com.questrail.ircproxy.codec.impl.JsonStreamDecoder;
import com.questrail.ircproxy.codec.impl.LineCodec;
import com.questrail.ircproxy.codec.impl.LineStreamDecoder;
import com.questrail.ircproxy.model.IrcCommand;
import com.questrail.ircproxy.model.IrcMessage;
import com.questrail.ircproxy.observability.FormatSwitchEvent;
import com.questrail.ircproxy.observability.RelayErrorEvent;
import com.questrail.ircproxy.observability.RelayObservabilitySink;
import com.questrail.ircproxy.observability.RelayProtocolEvent;
import com.questrail.ircproxy.observability.RelayTransportEvent;
import com.questrail.ircproxy.observability.TrafficDirection;
import com.questrail.ircproxy.observability.WireTrafficEvent;
import com.questrail.ircproxy.transport.StreamEndpoint;
import com.questrail.ircproxy.transport.StreamEndpointListener;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionChannel
 * =============================================================================
 * One leg of a relay: a {@link StreamEndpoint} plus the codec pair currently
 * active for each direction.
 *
 * <h2>Format-switch state machine</h2>
 * Each direction is independently in one of two states:
 *
 * <pre>
 *   RFC1459 ──(STARTJSON)──▶ JSON      (no way back)
 * </pre>
 *
 * <p>When a STARTJSON message is decoded while receiving RFC 1459:</p>
 * <ol>
 *   <li>the receive format becomes JSON;</li>
 *   <li>every byte the line decoder holds but has not consumed is fed to a
 *       fresh {@link JsonStreamDecoder}, so nothing is lost or parsed twice;</li>
 *   <li>the send side follows ({@link #enterJsonSendMode()}): STARTJSON is
 *       written with the old line encoder, then JSON is used for every
 *       subsequent outgoing message;</li>
 *   <li>the STARTJSON message itself is never handed to the listener.</li>
 * </ol>
 *
 * <p>A STARTJSON decoded while already receiving JSON is consumed and
 * reported as {@link RelayProtocolEvent.Kind#STARTJSON_IGNORED}.</p>
 *
 * <h2>Faults</h2>
 * <ul>
 *   <li>{@link IrcDecodeException}: the leg is closed at once.</li>
 *   <li>{@link IrcEncodeException}: the leg is closed rather than writing
 *       corrupt bytes.</li>
 *   <li>Transport disconnect: the leg is closed.</li>
 * </ul>
 * In every case the listener's {@link Listener#onClosed} fires exactly once,
 * and the relay pair cascades the close to the peer.
 *
 * <h2>Execution model</h2>
 * Not thread-safe. All calls, including transport callbacks and sends from
 * the peer leg, must come from one thread (the pair's event loop).
 */
public final class ConnectionChannel implements StreamEndpointListener
{
    public static final String STARTJSON = "startjson";

    /**
     * Receives what a channel decodes and how its lifecycle ends.
     */
    public interface Listener
    {
        /** A message other than STARTJSON was decoded. */
        void onMessage(ConnectionChannel source, IrcMessage message);

        /** The channel entered JSON receive mode. */
        void onReceiveFormatSwitched(ConnectionChannel source);

        /** The channel's outbound buffer crossed a water mark. */
        void onWritabilityChanged(ConnectionChannel source, boolean writable);

        /** The channel is closed; called exactly once. */
        void onClosed(ConnectionChannel source, Throwable cause);
    }

    private enum State
    {
        OPEN,
        CLOSING,
        CLOSED
    }

    private final LegId id;
    private final StreamEndpoint endpoint;
    private final RelayObservabilitySink sink;

    private final LineStreamDecoder lineDecoder = new LineStreamDecoder();
    private final LineCodec lineEncoder = new LineCodec();

    private IrcStreamDecoder decoder = lineDecoder;
    private IrcMessageEncoder encoder = lineEncoder;
    private WireFormat receiveFormat = WireFormat.RFC1459;
    private WireFormat sendFormat = WireFormat.RFC1459;

    private Listener listener;
    private ConnectionChannel peer;
    private State state = State.OPEN;

    /**
     * @param eagerJson start in JSON send mode, announcing it with STARTJSON
     *                  before anything else is written
     */
    public ConnectionChannel(LegId id, StreamEndpoint endpoint, RelayObservabilitySink sink, boolean eagerJson)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (eagerJson) {
            enterJsonSendMode();
        }
    }

    /**
     * Couple this channel to its listener and peer. Called once by
     * {@link RelayPair}.
     */
    void bind(Listener listener, ConnectionChannel peer)
    {
        if (this.listener != null) {
            throw new IllegalStateException(id + " is already bound");
        }
        this.listener = Objects.requireNonNull(listener, "listener");
        this.peer = Objects.requireNonNull(peer, "peer");
    }

    /**
     * Attach to the endpoint and start reading.
     */
    public void open()
    {
        if (listener == null) {
            throw new IllegalStateException(id + " must be bound before open()");
        }
        sink.onTransportEvent(new RelayTransportEvent(
                Instant.now(), id, RelayTransportEvent.Kind.CONNECTED, endpoint.remoteAddress(), null));
        endpoint.setListener(this);
        if (state == State.OPEN) {
            endpoint.setReading(true);
        }
    }

    public LegId id()
    {
        return id;
    }

    public ConnectionChannel peer()
    {
        return peer;
    }

    public WireFormat receiveFormat()
    {
        return receiveFormat;
    }

    public WireFormat sendFormat()
    {
        return sendFormat;
    }

    public boolean isOpen()
    {
        return state == State.OPEN;
    }

    // -------------------------------------------------------------------------
    // Receive path
    // -------------------------------------------------------------------------

    @Override
    public void onBytes(byte[] payload)
    {
        if (state != State.OPEN) {
            return;
        }

        sink.onTraffic(new WireTrafficEvent(Instant.now(), id, TrafficDirection.READ, payload));
        decoder.feed(payload);

        try {
            drain();
        }
        catch (IrcDecodeException e) {
            fail("Cannot decode " + receiveFormat.label() + " input", e);
        }
    }

    private void drain()
    {
        Optional<IrcMessage> next;
        while (state == State.OPEN && (next = decoder.next()).isPresent()) {
            IrcMessage message = next.get();

            if (message.command().is(STARTJSON)) {
                onStartJson();
                continue;
            }
            listener.onMessage(this, message);
        }
    }

    private void onStartJson()
    {
        if (receiveFormat == WireFormat.JSON) {
            sink.onProtocolEvent(new RelayProtocolEvent(
                    Instant.now(), id, RelayProtocolEvent.Kind.STARTJSON_IGNORED));
            return;
        }
        enterJsonReceiveMode();
    }

    /**
     * Switch the receive direction to JSON, carrying over unconsumed bytes,
     * then reciprocate on the send direction.
     */
    void enterJsonReceiveMode()
    {
        if (receiveFormat == WireFormat.JSON) {
            return;
        }

        byte[] carried = lineDecoder.takeUnconsumed();
        JsonStreamDecoder jsonDecoder = new JsonStreamDecoder();
        jsonDecoder.feed(carried);

        decoder = jsonDecoder;
        receiveFormat = WireFormat.JSON;
        sink.onFormatSwitch(new FormatSwitchEvent(
                Instant.now(), id, FormatSwitchEvent.Side.RECEIVE, WireFormat.RFC1459, WireFormat.JSON));

        enterJsonSendMode();
        listener.onReceiveFormatSwitched(this);
    }

    // -------------------------------------------------------------------------
    // Send path
    // -------------------------------------------------------------------------

    /**
     * Switch the send direction to JSON. If it is not JSON already, the
     * STARTJSON signal is written in RFC 1459 form first. Idempotent.
     */
    public void enterJsonSendMode()
    {
        if (sendFormat == WireFormat.JSON || state == State.CLOSED) {
            return;
        }

        write(lineEncoder.encode(new IrcMessage(new IrcCommand.Token(STARTJSON), List.of())));
        encoder = new JsonCodec();
        sendFormat = WireFormat.JSON;
        sink.onFormatSwitch(new FormatSwitchEvent(
                Instant.now(), id, FormatSwitchEvent.Side.SEND, WireFormat.RFC1459, WireFormat.JSON));
    }

    /**
     * Serialize a message with the active send codec and write it.
     * Messages sent after the channel started closing are dropped.
     */
    public void send(IrcMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (state != State.OPEN) {
            return;
        }

        final byte[] bytes;
        try {
            bytes = encoder.encode(message);
        }
        catch (IrcEncodeException e) {
            fail("Cannot encode message as " + sendFormat.label(), e);
            return;
        }
        write(bytes);
    }

    private void write(byte[] bytes)
    {
        sink.onTraffic(new WireTrafficEvent(Instant.now(), id, TrafficDirection.WRITE, bytes));
        endpoint.write(bytes);
    }

    // -------------------------------------------------------------------------
    // Flow control and lifecycle
    // -------------------------------------------------------------------------

    public void setReading(boolean reading)
    {
        if (state == State.OPEN) {
            endpoint.setReading(reading);
        }
    }

    @Override
    public void onWritabilityChanged(boolean writable)
    {
        if (state == State.OPEN && listener != null) {
            listener.onWritabilityChanged(this, writable);
        }
    }

    /**
     * Stop processing input and close once pending writes are flushed.
     */
    public void closeAfterWriting()
    {
        if (state != State.OPEN) {
            return;
        }
        state = State.CLOSING;
        endpoint.closeAfterWriting();
    }

    @Override
    public void onDisconnected(Throwable cause)
    {
        if (state == State.CLOSED) {
            return;
        }

        try {
            decoder.finish();
        }
        catch (IrcDecodeException e) {
            sink.onError(new RelayErrorEvent(Instant.now(), id, e.getMessage(), e));
        }

        sink.onTransportEvent(new RelayTransportEvent(
                Instant.now(), id, RelayTransportEvent.Kind.DISCONNECTED, endpoint.remoteAddress(), cause));
        if (cause != null) {
            sink.onError(new RelayErrorEvent(Instant.now(), id, "Transport fault", cause));
        }
        closed(cause);
    }

    private void fail(String message, RuntimeException cause)
    {
        sink.onError(new RelayErrorEvent(Instant.now(), id, message + ": " + cause.getMessage(), cause));
        endpoint.close();
        closed(cause);
    }

    private void closed(Throwable cause)
    {
        state = State.CLOSED;
        if (listener != null) {
            listener.onClosed(this, cause);
        }
    }

    @Override
    public String toString()
    {
        return "ConnectionChannel{" + id
                + ", receive=" + receiveFormat
                + ", send=" + sendFormat
                + ", state=" + state + '}';
    }
}
