package com.questrail.ircproxy.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 *
 * <p>Traffic lines look like {@code #3/C >> "NICK foo\r\n"}: pair number, leg
 * marker ({@code C} clientwards, {@code S} serverwards), {@code >>} for a read
 * and {@code <<} for a write.</p>
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onTraffic(WireTrafficEvent event) {
        if (log.isInfoEnabled()) {
            log.info("{} {} {}", event.leg(), event.direction().arrow(), event.quotedText());
        }
    }

    @Override
    public void onFormatSwitch(FormatSwitchEvent event) {
        log.info("{} {} format: {} -> {}",
            event.leg(),
            event.side(),
            event.from(),
            event.to());
    }

    @Override
    public void onProtocolEvent(RelayProtocolEvent event) {
        log.debug("{} protocol event: {}", event.leg(), event.kind());
    }

    @Override
    public void onTransportEvent(RelayTransportEvent event) {
        if (event.cause() != null) {
            log.info("{} {} {} ({})", event.leg(), event.kind(), event.remote(), event.cause().toString());
        } else {
            log.info("{} {} {}", event.leg(), event.kind(), event.remote());
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("{} relay error: {}", event.leg(), event.message(), event.cause());
    }
}
