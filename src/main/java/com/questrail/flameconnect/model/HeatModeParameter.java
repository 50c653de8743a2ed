package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Heat control availability (id 325).
 */
public record HeatModeParameter(HeatControl heatControl) implements WritableParameter
{
    public HeatModeParameter {
        Objects.requireNonNull(heatControl, "heatControl");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.HEAT_MODE;
    }
}
