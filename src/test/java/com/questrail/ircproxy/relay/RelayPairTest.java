package com.questrail.ircproxy.relay;

import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.observability.RecordingObservabilitySink;
import com.questrail.ircproxy.observability.RelayProtocolEvent;
import com.questrail.ircproxy.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

final class RelayPairTest
{
    private static final String PRIVMSG_JSON =
            "{\"tags\":{},\"source\":null,\"verb\":\"privmsg\",\"params\":[\"#chan\",\"hi\"]}";

    private final FakeStreamEndpoint client = new FakeStreamEndpoint();
    private final FakeStreamEndpoint server = new FakeStreamEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void clientLinesReachServerInOrder()
    {
        pair(false, false);

        String lines = "NICK alice\r\nUSER alice 0 * :Alice Liddell\r\nJOIN #chan\r\nPRIVMSG #chan :hello\r\n";
        client.inject(lines);

        assertEquals(lines, server.writtenText());
    }

    @Test
    void serverLinesReachClientUnchanged()
    {
        pair(false, false);

        String lines = ":irc.example.com 001 nick :Welcome\r\n"
                + "@time=2021-01-01T00:00:00Z :nick!u@h PRIVMSG #chan :hi there\r\n";
        server.inject(lines);

        assertEquals(lines, client.writtenText());
    }

    @Test
    void startJsonIsNeverForwarded()
    {
        pair(false, false);

        client.inject("PING a\r\nSTARTJSON\r\n{\"verb\":\"ping\",\"params\":[\"b\"]}");

        assertEquals("PING a\r\nPING b\r\n", server.writtenText());
        assertEquals("STARTJSON\r\n", client.writtenText());
    }

    @Test
    void eachDirectionSwitchesIndependently()
    {
        RelayPair pair = pair(false, false);

        client.inject("STARTJSON\r\n");
        server.inject(":irc.example.com PONG :x\r\n");

        assertEquals(WireFormat.JSON, pair.downstream().receiveFormat());
        assertEquals(WireFormat.RFC1459, pair.upstream().receiveFormat());
        assertEquals(WireFormat.RFC1459, pair.upstream().sendFormat());
        assertEquals("STARTJSON\r\n"
                + "{\"tags\":{},\"source\":\"irc.example.com\",\"verb\":\"pong\",\"params\":[\"x\"]}",
                client.writtenText());
    }

    @Test
    void propagatedSwitchAnnouncesJsonUpstream()
    {
        pair(false, true);

        client.inject("STARTJSON\r\n");
        client.inject(PRIVMSG_JSON);

        assertEquals("STARTJSON\r\n" + PRIVMSG_JSON, server.writtenText());
    }

    @Test
    void eagerUpstreamReceivesJsonForNativeClientLines()
    {
        pair(true, false);

        client.inject("PRIVMSG #chan :hi\r\n");

        assertEquals("STARTJSON\r\n" + PRIVMSG_JSON, server.writtenText());
        assertEquals("", client.writtenText());
    }

    @Test
    void eagerUpstreamAnnouncesBeforeAnyClientTraffic()
    {
        pair(true, false);

        assertEquals("STARTJSON\r\n", server.writtenText());
    }

    @Test
    void quitFromClientIsForwardedThenBothLegsClose()
    {
        RelayPair pair = pair(false, false);

        client.inject("QUIT :bye\r\nPRIVMSG #chan :too late\r\n");

        assertEquals("QUIT :bye\r\n", server.writtenText());
        assertTrue(client.closeAfterWritingRequested());
        assertTrue(server.closeAfterWritingRequested());
        assertFalse(pair.downstream().isOpen());
        assertFalse(pair.upstream().isOpen());
        assertEquals(RelayProtocolEvent.Kind.QUIT_OBSERVED,
                sink.eventsOfType(RelayProtocolEvent.class).get(0).kind());
    }

    @Test
    void quitFromServerIsOnlyForwarded()
    {
        pair(false, false);

        server.inject(":nick!u@h QUIT :gone\r\n");

        assertEquals(":nick!u@h QUIT :gone\r\n", client.writtenText());
        assertFalse(client.closeAfterWritingRequested());
        assertFalse(server.closeAfterWritingRequested());
    }

    @Test
    void serverDisconnectClosesClientAfterFlush()
    {
        RelayPair pair = pair(false, false);

        server.inject("ERROR :Closing link\r\n");
        server.disconnect(null);

        assertEquals("ERROR :Closing link\r\n", client.writtenText());
        assertTrue(client.closeAfterWritingRequested());
        assertFalse(pair.downstream().isOpen());
    }

    @Test
    void clientFaultClosesServer()
    {
        pair(false, false);

        client.disconnect(new IOException("reset"));

        assertTrue(server.closeAfterWritingRequested());
    }

    @Test
    void decodeErrorOnOneLegTearsDownBoth()
    {
        RelayPair pair = pair(false, false);

        client.inject("STARTJSON\r\nnot json");

        assertTrue(client.isClosed());
        assertTrue(server.closeAfterWritingRequested());
        assertFalse(pair.upstream().isOpen());
    }

    @Test
    void slowClientPausesServerReads()
    {
        pair(false, false);

        client.writabilityChanged(false);
        assertFalse(server.isReading());
        assertTrue(client.isReading());

        client.writabilityChanged(true);
        assertTrue(server.isReading());
    }

    @Test
    void slowServerPausesClientReads()
    {
        pair(false, false);

        server.writabilityChanged(false);
        assertFalse(client.isReading());

        server.writabilityChanged(true);
        assertTrue(client.isReading());
    }

    @Test
    void channelsMustBeDistinct()
    {
        ConnectionChannel channel = new ConnectionChannel(new LegId(1, RelayLeg.DOWNSTREAM), client, sink, false);

        assertThrows(IllegalArgumentException.class, () -> new RelayPair(channel, channel, sink, false));
    }

    private RelayPair pair(boolean eagerUpstream, boolean propagate)
    {
        ConnectionChannel downstream = new ConnectionChannel(new LegId(7, RelayLeg.DOWNSTREAM), client, sink, false);
        ConnectionChannel upstream = new ConnectionChannel(new LegId(7, RelayLeg.UPSTREAM), server, sink, eagerUpstream);
        RelayPair pair = new RelayPair(downstream, upstream, sink, propagate);
        pair.open();
        return pair;
    }
}
