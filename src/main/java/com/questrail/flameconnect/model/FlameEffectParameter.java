package com.questrail.flameconnect.model;

import java.util.Objects;

/**
 * Flame, media bed and overhead lighting settings (id 322).
 *
 * <p>{@code flameSpeed} is 1-based (1–5) here; the wire stores it 0-based.
 * {@code lightStatus} and {@code ambientSensor} are the two sensor flags,
 * {@code mediaLight} and {@code overheadLight} the two light flags.</p>
 */
public record FlameEffectParameter(
        FlameEffect flameEffect,
        int flameSpeed,
        Brightness brightness,
        PulsatingEffect pulsatingEffect,
        MediaTheme mediaTheme,
        LightStatus mediaLight,
        RGBWColor mediaColor,
        LightStatus overheadLight,
        RGBWColor overheadColor,
        LightStatus lightStatus,
        FlameColor flameColor,
        LightStatus ambientSensor
) implements WritableParameter
{
    public FlameEffectParameter {
        Objects.requireNonNull(flameEffect, "flameEffect");
        Objects.requireNonNull(brightness, "brightness");
        Objects.requireNonNull(pulsatingEffect, "pulsatingEffect");
        Objects.requireNonNull(mediaTheme, "mediaTheme");
        Objects.requireNonNull(mediaLight, "mediaLight");
        Objects.requireNonNull(mediaColor, "mediaColor");
        Objects.requireNonNull(overheadLight, "overheadLight");
        Objects.requireNonNull(overheadColor, "overheadColor");
        Objects.requireNonNull(lightStatus, "lightStatus");
        Objects.requireNonNull(flameColor, "flameColor");
        Objects.requireNonNull(ambientSensor, "ambientSensor");
    }

    @Override
    public ParameterKind kind()
    {
        return ParameterKind.FLAME_EFFECT;
    }

    /**
     * Returns a copy of this value with the flame effect replaced.
     */
    public FlameEffectParameter withFlameEffect(FlameEffect effect)
    {
        return new FlameEffectParameter(effect, flameSpeed, brightness, pulsatingEffect,
                mediaTheme, mediaLight, mediaColor, overheadLight, overheadColor,
                lightStatus, flameColor, ambientSensor);
    }
}
