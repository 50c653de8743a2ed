package com.questrail.flameconnect.model;

/**
 * Availability of heat control on the appliance.
 */
public enum HeatControl implements WireEnum
{
    SOFTWARE_DISABLED(0),
    HARDWARE_DISABLED(1),
    ENABLED(2);

    private final int wireValue;

    HeatControl(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
