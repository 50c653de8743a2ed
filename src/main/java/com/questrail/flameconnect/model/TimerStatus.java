package com.questrail.flameconnect.model;

/**
 * Count-down timer enabled/disabled.
 */
public enum TimerStatus implements WireEnum
{
    DISABLED(0),
    ENABLED(1);

    private final int wireValue;

    TimerStatus(int wireValue)
    {
        this.wireValue = wireValue;
    }

    @Override
    public int wireValue()
    {
        return wireValue;
    }
}
