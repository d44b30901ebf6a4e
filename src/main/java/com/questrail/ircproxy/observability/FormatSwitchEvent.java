package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.codec.WireFormat;
import com.questrail.ircproxy.relay.LegId;

import java.time.Instant;

/**
 * Record of one direction of a leg changing its wire format.
 */
public record FormatSwitchEvent(
    Instant timestamp,
    LegId leg,
    Side side,
    WireFormat from,
    WireFormat to
) {
    /** Which codec of the leg switched. */
    public enum Side {
        RECEIVE,
        SEND
    }
}
