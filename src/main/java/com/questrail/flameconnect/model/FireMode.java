package com.questrail.flameconnect.model;

/**
 * Fireplace operating mode.
 */
public enum FireMode implements WireEnum
{
    STANDBY(0),
    MANUAL(1);

    private final int wireValue;

    FireMode(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
