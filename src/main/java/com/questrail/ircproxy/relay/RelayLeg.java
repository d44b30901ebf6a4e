package com.questrail.ircproxy.relay;

/**
 * The two sides of a relayed connection.
 */
public enum RelayLeg
{
    /** Client-facing connection, accepted by the relay. */
    DOWNSTREAM('C'),

    /** Server-facing connection, dialed by the relay. */
    UPSTREAM('S');

    private final char marker;

    RelayLeg(char marker)
    {
        this.marker = marker;
    }

    /**
     * Short marker used in traffic logs: {@code C} for clientwards,
     * {@code S} for serverwards.
     */
    public char marker()
    {
        return marker;
    }

    public RelayLeg opposite()
    {
        return this == DOWNSTREAM ? UPSTREAM : DOWNSTREAM;
    }
}
