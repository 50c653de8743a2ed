package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Operating mode and target temperature (id 321).
 *
 * <p>The temperature has one decimal digit of precision and is expected to
 * lie in {@code [0, 255.9]}.</p>
 */
public record ModeParameter(FireMode mode, double temperature) implements WritableParameter
{
    public ModeParameter {
        Objects.requireNonNull(mode, "mode");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.MODE;
    }
}
