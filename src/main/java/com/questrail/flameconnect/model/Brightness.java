package com.questrail.flameconnect.model;

/**
 * Flame brightness level, carried in bit 0 of the FlameEffect brightness byte.
 */
public enum Brightness implements WireEnum
{
    HIGH(0),
    LOW(1);

    private final int wireValue;

    Brightness(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
