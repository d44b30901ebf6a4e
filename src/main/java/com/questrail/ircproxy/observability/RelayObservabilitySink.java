package com.questrail.ircproxy.observability;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or tracing; none of them may
 * influence relay behavior.
 */
public interface RelayObservabilitySink {
    /**
     * Called for every chunk of raw bytes read from or written to a leg.
     * @param event the traffic details
     */
    void onTraffic(WireTrafficEvent event);

    /**
     * Called when one direction of a leg changes wire format.
     * @param event the transition details
     */
    void onFormatSwitch(FormatSwitchEvent event);

    /**
     * Called when an IRC-level signal is handled by the relay itself.
     * @param event the protocol event
     */
    void onProtocolEvent(RelayProtocolEvent event);

    /**
     * Called when a transport-level event occurs (e.g., connection up/down).
     * @param event the transport event
     */
    void onTransportEvent(RelayTransportEvent event);

    /**
     * Called when a fault closes, or is about to close, a leg.
     * @param event the error event
     */
    void onError(RelayErrorEvent event);
}
