package com.questrail.flameconnect.model;

/**
 * Fuel-bed media theme preset.
 */
public enum MediaTheme implements WireEnum
{
    USER_DEFINED(0),
    WHITE(1),
    BLUE(2),
    PURPLE(3),
    RED(4),
    GREEN(5),
    PRISM(6),
    KALEIDOSCOPE(7),
    MIDNIGHT(8);

    private final int wireValue;

    MediaTheme(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
