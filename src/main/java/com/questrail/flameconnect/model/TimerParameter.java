package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Count-down timer (id 326).
 *
 * @param duration remaining duration in minutes, unsigned 16-bit
 */
public record TimerParameter(TimerStatus timerStatus, int duration) implements WritableParameter
{
    public TimerParameter {
        Objects.requireNonNull(timerStatus, "timerStatus");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.TIMER;
    }
}
