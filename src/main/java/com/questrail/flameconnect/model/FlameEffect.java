package com.questrail.flameconnect.model;

/**
 * Flame effect on/off.
 */
public enum FlameEffect implements WireEnum
{
    OFF(0),
    ON(1);

    private final int wireValue;

    FlameEffect(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
