package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.relay.LegId;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record of a transport lifecycle change on one leg.
 */
public record RelayTransportEvent(
    Instant timestamp,
    LegId leg,
    Kind kind,
    SocketAddress remote,
    Throwable cause
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        DIAL_FAILED
    }
}
