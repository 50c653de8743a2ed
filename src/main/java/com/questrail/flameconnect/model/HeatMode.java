package com.questrail.flameconnect.model;

/**
 * Heater operating mode.
 */
public enum HeatMode implements WireEnum
{
    NORMAL(0),
    BOOST(1),
    ECO(2),
    FAN_ONLY(3),
    SCHEDULE(4);

    private final int wireValue;

    HeatMode(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
