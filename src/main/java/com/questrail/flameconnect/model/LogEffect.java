package com.questrail.flameconnect.model;

/**
 * Log/ember bed effect on/off.
 */
public enum LogEffect implements WireEnum
{
    OFF(0),
    ON(1);

    private final int wireValue;

    LogEffect(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
