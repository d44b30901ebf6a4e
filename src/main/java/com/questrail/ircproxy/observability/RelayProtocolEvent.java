package com.questrail.ircproxy.observability;

import com.questrail.ircproxy.relay.LegId;

import java.time.Instant;

/**
 * Record of an IRC-level signal that the relay acted on.
 */
public record RelayProtocolEvent(
    Instant timestamp,
    LegId leg,
    Kind kind
) {
    public enum Kind {
        /** STARTJSON arrived while the leg was already receiving JSON; consumed without effect. */
        STARTJSON_IGNORED,

        /** QUIT arrived from the client; both legs close after flushing. */
        QUIT_OBSERVED
    }
}
