package com.questrail.ircproxy.relay;

import java.util.Objects;

/**
 * Identifies one leg of one relayed connection in diagnostics.
 *
 * @param pair sequence number of the relay pair
 * @param leg  which side of the pair
 */
public record LegId(long pair, RelayLeg leg)
{
    public LegId {
        Objects.requireNonNull(leg, "leg");
    }

    public LegId peer()
    {
        return new LegId(pair, leg.opposite());
    }

    @Override
    public String toString()
    {
        return "#" + pair + "/" + leg.marker();
    }
}
