package com.questrail.flameconnect.model;

/**
 * Parameter kinds the appliance accepts in a write request.
 *
 * <p>For every value {@code v} of these types, decoding the encoded frame of
 * {@code v} yields a value equal to {@code v}.</p>
 */
public sealed interface WritableParameter extends Parameter
        permits TemperatureUnitParameter, ModeParameter, FlameEffectParameter,
                HeatSettingsParameter, HeatModeParameter, TimerParameter,
                SoundParameter, LogEffectParameter {
}
