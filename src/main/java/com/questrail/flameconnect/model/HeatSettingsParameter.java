package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Heater status, mode, setpoint and boost duration (id 323).
 *
 * @param boostDuration boost duration in minutes, unsigned 16-bit
 */
public record HeatSettingsParameter(
        HeatStatus heatStatus,
        HeatMode heatMode,
        double setpointTemperature,
        int boostDuration
) implements WritableParameter
{
    public HeatSettingsParameter {
        Objects.requireNonNull(heatStatus, "heatStatus");
        Objects.requireNonNull(heatMode, "heatMode");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.HEAT_SETTINGS;
    }
}
