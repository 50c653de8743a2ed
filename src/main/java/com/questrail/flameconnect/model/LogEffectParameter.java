package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Log/ember bed effect (id 370).
 *
 * <p>The wire record also reserves a theme byte; the appliance reports the
 * active look through {@code pattern}, so the theme byte is not modelled.</p>
 */
public record LogEffectParameter(LogEffect logEffect, RGBWColor color, int pattern) implements WritableParameter
{
    public LogEffectParameter {
        Objects.requireNonNull(logEffect, "logEffect");
        Objects.requireNonNull(color, "color");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.LOG_EFFECT;
    }
}
