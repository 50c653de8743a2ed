package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Temperature display unit (id 236).
 */
public record TemperatureUnitParameter(TemperatureUnit unit) implements WritableParameter
{
    public TemperatureUnitParameter {
        Objects.requireNonNull(unit, "unit");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.TEMPERATURE_UNIT;
    }
}
