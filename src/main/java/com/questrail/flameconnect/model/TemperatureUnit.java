package com.questrail.flameconnect.model;

/**
 * Temperature display unit.
 */
public enum TemperatureUnit implements WireEnum
{
    FAHRENHEIT(0),
    CELSIUS(1);

    private final int wireValue;

    TemperatureUnit(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
