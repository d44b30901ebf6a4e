package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.relay.LegId;

import java.time.Instant;

/**
 * Record representing a fault on one leg of the relay.
 */
public record RelayErrorEvent(
    Instant timestamp,
    LegId leg,
    String message,
    Throwable cause
) {
}
