package com.questrail.flameconnect.model;

/**
 * Flame colour preset.
 */
public enum FlameColor implements WireEnum
{
    ALL(0),
    YELLOW_RED(1),
    YELLOW_BLUE(2),
    BLUE(3),
    RED(4),
    YELLOW(5),
    BLUE_RED(6);

    private final int wireValue;

    FlameColor(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
