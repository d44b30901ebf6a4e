package com.questrail.ircproxy.observability;

/**
 * Direction of raw bytes relative to the relay.
 */
public enum TrafficDirection {
    /** Bytes received from the remote side ({@code >>}). */
    READ(">>"),

    /** Bytes sent to the remote side ({@code <<}). */
    WRITE("<<");

    private final String arrow;

    TrafficDirection(String arrow) {
        this.arrow = arrow;
    }

    public String arrow() {
        return arrow;
    }
}
