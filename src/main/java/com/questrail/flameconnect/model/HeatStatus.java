package com.questrail.flameconnect.model;

/**
 * Heater on/off status.
 */
public enum HeatStatus implements WireEnum
{
    OFF(0),
    ON(1);

    private final int wireValue;

    HeatStatus(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
