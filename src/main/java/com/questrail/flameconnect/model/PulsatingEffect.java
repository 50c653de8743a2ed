package com.questrail.flameconnect.model;

/**
 * Pulsating flame effect, carried in bit 1 of the FlameEffect brightness byte.
 */
public enum PulsatingEffect implements WireEnum
{
    OFF(0),
    ON(1);

    private final int wireValue;

    PulsatingEffect(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
