package com.questrail.flameconnect.model;

/**
 * Generic light or sensor on/off flag.
 */
public enum LightStatus implements WireEnum
{
    OFF(0),
    ON(1);

    private final int wireValue;

    LightStatus(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
