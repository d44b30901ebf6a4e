package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.relay.LegId;
import com.questrail.ircproxy.relay.RelayLeg;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class WireTrafficEventTest {

    @Test
    void quotedTextEscapesControlCharacters() {
        WireTrafficEvent event = new WireTrafficEvent(
            Instant.EPOCH,
            new LegId(3, RelayLeg.DOWNSTREAM),
            TrafficDirection.READ,
            "PRIVMSG #c :\"hi\"\t\u0001\r\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("\"PRIVMSG #c :\\\"hi\\\"\\t\\x01\\r\\n\"", event.quotedText());
    }

    @Test
    void legIdRendersPairAndMarker() {
        assertEquals("#3/C", new LegId(3, RelayLeg.DOWNSTREAM).toString());
        assertEquals("#3/S", new LegId(3, RelayLeg.DOWNSTREAM).peer().toString());
    }

    @Test
    void sinksAcceptEveryEventKind() {
        LegId leg = new LegId(1, RelayLeg.UPSTREAM);
        RelayObservabilitySink[] sinks = {
            NullObservabilitySink.INSTANCE, new Slf4jRelayObservabilitySink()
        };

        for (RelayObservabilitySink sink : sinks) {
            assertDoesNotThrow(() -> {
                sink.onTraffic(new WireTrafficEvent(Instant.now(), leg, TrafficDirection.WRITE, new byte[] { 'x' }));
                sink.onFormatSwitch(new FormatSwitchEvent(Instant.now(), leg, FormatSwitchEvent.Side.SEND,
                    WireFormat.RFC1459, WireFormat.JSON));
                sink.onProtocolEvent(new RelayProtocolEvent(Instant.now(), leg, RelayProtocolEvent.Kind.QUIT_OBSERVED));
                sink.onTransportEvent(new RelayTransportEvent(Instant.now(), leg,
                    RelayTransportEvent.Kind.CONNECTED, null, null));
                sink.onError(new RelayErrorEvent(Instant.now(), leg, "boom", new IllegalStateException("boom")));
            });
        }
    }
}
