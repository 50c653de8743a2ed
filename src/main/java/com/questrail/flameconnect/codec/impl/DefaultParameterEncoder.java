package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.CodecResult;
import com.questrail.flameconnect.codec.ParameterEncoder;
import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.*;

import java.util.Objects;

/**
 * DefaultParameterEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ParameterEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultParameterDecoder}: it
 * writes the header with the kind's fixed payload length, then every payload
 * byte at the offset the decoder reads it from, re-applying the Red, Blue,
 * Green, White colour order and the 1-based to 0-based speed translation and
 * writing zero at every padding offset.</p>
 *
 * <p>{@link SoftwareVersionParameter} and {@link ErrorParameter} are always
 * rejected with {@link ProtocolError.ReadOnly}.</p>
 */
public final class DefaultParameterEncoder implements ParameterEncoder
{
    @Override
    public CodecResult<byte[]> encode(Parameter parameter)
    {
        Objects.requireNonNull(parameter, "parameter");

        final ParameterKind kind = parameter.kind();
        if (kind.readOnly()) {
            return CodecResult.failure(new ProtocolError.ReadOnly(kind));
        }

        final FrameWriter out = new FrameWriter(kind);
        switch (kind) {
            case TEMPERATURE_UNIT -> encodeTemperatureUnit(out, (TemperatureUnitParameter) parameter);
            case MODE -> encodeMode(out, (ModeParameter) parameter);
            case FLAME_EFFECT -> encodeFlameEffect(out, (FlameEffectParameter) parameter);
            case HEAT_SETTINGS -> encodeHeatSettings(out, (HeatSettingsParameter) parameter);
            case HEAT_MODE -> encodeHeatMode(out, (HeatModeParameter) parameter);
            case TIMER -> encodeTimer(out, (TimerParameter) parameter);
            case SOUND -> encodeSound(out, (SoundParameter) parameter);
            case LOG_EFFECT -> encodeLogEffect(out, (LogEffectParameter) parameter);
            case SOFTWARE_VERSION, ERROR ->
                    // Guarded by readOnly() above.
                    throw new IllegalStateException("Read-only kind reached encoder: " + kind);
        }
        return CodecResult.success(out.toByteArray());
    }

    // ========================================================================
    // Per-kind writers
    // ========================================================================

    private static void encodeTemperatureUnit(FrameWriter out, TemperatureUnitParameter p)
    {
        out.wire(p.unit());
    }

    private static void encodeMode(FrameWriter out, ModeParameter p)
    {
        out.wire(p.mode())
                .temperature(p.temperature());
    }

    private static void encodeFlameEffect(FrameWriter out, FlameEffectParameter p)
    {
        final int lighting = p.brightness().wireValue() | (p.pulsatingEffect().wireValue() << 1);

        out.wire(p.flameEffect())
                .u8(Math.max(0, p.flameSpeed() - 1))
                .u8(lighting)
                .wire(p.mediaTheme())
                .wire(p.mediaLight())
                .color(p.mediaColor())
                .padding(1)
                .wire(p.overheadLight())
                .color(p.overheadColor())
                .wire(p.lightStatus())
                .wire(p.flameColor())
                .padding(2)
                .wire(p.ambientSensor());
    }

    private static void encodeHeatSettings(FrameWriter out, HeatSettingsParameter p)
    {
        out.wire(p.heatStatus())
                .wire(p.heatMode())
                .temperature(p.setpointTemperature())
                .u16le(p.boostDuration());
    }

    private static void encodeHeatMode(FrameWriter out, HeatModeParameter p)
    {
        out.wire(p.heatControl());
    }

    private static void encodeTimer(FrameWriter out, TimerParameter p)
    {
        out.wire(p.timerStatus())
                .u16le(p.duration());
    }

    private static void encodeSound(FrameWriter out, SoundParameter p)
    {
        out.u8(p.volume())
                .u8(p.soundFile());
    }

    private static void encodeLogEffect(FrameWriter out, LogEffectParameter p)
    {
        out.wire(p.logEffect())
                .padding(1) // theme
                .color(p.color())
                .u8(p.pattern())
                .padding(1);
    }
}
