package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.CodecResult;
import com.questrail.flameconnect.codec.ParameterDecoder;
import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.*;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultParameterDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ParameterDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Resolve the parameter id to a {@link ParameterKind}</li>
 *   <li>Guard the kind's fixed frame length</li>
 *   <li>Read fields at fixed frame offsets (payload starts at 3)</li>
 * </ol>
 *
 * <p><strong>Layout quirks reproduced here:</strong></p>
 * <ul>
 *   <li>Colours are stored Red, Blue, Green, White</li>
 *   <li>Flame speed is stored 0-based and exposed 1-based</li>
 *   <li>Padding bytes in FlameEffect and LogEffect are skipped unread</li>
 * </ul>
 */
public final class DefaultParameterDecoder implements ParameterDecoder
{
    @Override
    public CodecResult<Parameter> decode(int parameterId, byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        final Optional<ParameterKind> resolved = ParameterKind.fromId(parameterId);
        if (resolved.isEmpty()) {
            return CodecResult.failure(new ProtocolError.UnknownParameter(parameterId));
        }

        final ParameterKind kind = resolved.get();
        final Optional<ProtocolError> tooShort = FrameHeader.checkLength(kind, frame);
        if (tooShort.isPresent()) {
            return CodecResult.failure(tooShort.get());
        }

        try (FrameReader in = new FrameReader(kind, frame)) {
            final Parameter decoded = switch (kind) {
                case TEMPERATURE_UNIT -> decodeTemperatureUnit(in);
                case MODE -> decodeMode(in);
                case FLAME_EFFECT -> decodeFlameEffect(in);
                case HEAT_SETTINGS -> decodeHeatSettings(in);
                case HEAT_MODE -> decodeHeatMode(in);
                case TIMER -> decodeTimer(in);
                case SOFTWARE_VERSION -> decodeSoftwareVersion(in);
                case ERROR -> decodeError(in);
                case SOUND -> decodeSound(in);
                case LOG_EFFECT -> decodeLogEffect(in);
            };
            return CodecResult.success(decoded);
        }
        catch (UnsupportedValueException e) {
            return CodecResult.failure(e.error());
        }
    }

    // ========================================================================
    // Per-kind readers
    // ========================================================================

    private static TemperatureUnitParameter decodeTemperatureUnit(FrameReader in)
            throws UnsupportedValueException
    {
        return new TemperatureUnitParameter(in.enumAt(3, TemperatureUnit.class, "unit"));
    }

    private static ModeParameter decodeMode(FrameReader in) throws UnsupportedValueException
    {
        return new ModeParameter(
                in.enumAt(3, FireMode.class, "mode"),
                in.temperature(4)
        );
    }

    private static FlameEffectParameter decodeFlameEffect(FrameReader in) throws UnsupportedValueException
    {
        // Offset 5 packs brightness (bit 0) and pulsating effect (bit 1).
        final int lighting = in.u8(5);

        return new FlameEffectParameter(
                in.enumAt(3, FlameEffect.class, "flameEffect"),
                in.u8(4) + 1,
                in.enumOf(lighting & 0x01, Brightness.class, "brightness"),
                in.enumOf((lighting >> 1) & 0x01, PulsatingEffect.class, "pulsatingEffect"),
                in.enumAt(6, MediaTheme.class, "mediaTheme"),
                in.enumAt(7, LightStatus.class, "mediaLight"),
                in.color(8),
                // 12: padding
                in.enumAt(13, LightStatus.class, "overheadLight"),
                in.color(14),
                in.enumAt(18, LightStatus.class, "lightStatus"),
                in.enumAt(19, FlameColor.class, "flameColor"),
                // 20, 21: padding
                in.enumAt(22, LightStatus.class, "ambientSensor")
        );
    }

    private static HeatSettingsParameter decodeHeatSettings(FrameReader in) throws UnsupportedValueException
    {
        return new HeatSettingsParameter(
                in.enumAt(3, HeatStatus.class, "heatStatus"),
                in.enumAt(4, HeatMode.class, "heatMode"),
                in.temperature(5),
                in.u16le(7)
        );
    }

    private static HeatModeParameter decodeHeatMode(FrameReader in) throws UnsupportedValueException
    {
        return new HeatModeParameter(in.enumAt(3, HeatControl.class, "heatControl"));
    }

    private static TimerParameter decodeTimer(FrameReader in) throws UnsupportedValueException
    {
        return new TimerParameter(
                in.enumAt(3, TimerStatus.class, "timerStatus"),
                in.u16le(4)
        );
    }

    private static SoftwareVersionParameter decodeSoftwareVersion(FrameReader in)
    {
        return new SoftwareVersionParameter(
                in.u8(3), in.u8(4), in.u8(5),
                in.u8(6), in.u8(7), in.u8(8),
                in.u8(9), in.u8(10), in.u8(11)
        );
    }

    private static ErrorParameter decodeError(FrameReader in)
    {
        return new ErrorParameter(in.u8(3), in.u8(4), in.u8(5), in.u8(6));
    }

    private static SoundParameter decodeSound(FrameReader in)
    {
        return new SoundParameter(in.u8(3), in.u8(4));
    }

    private static LogEffectParameter decodeLogEffect(FrameReader in) throws UnsupportedValueException
    {
        return new LogEffectParameter(
                in.enumAt(3, LogEffect.class, "logEffect"),
                // 4: theme, not modelled
                in.color(5),
                in.u8(9)
                // 10: padding
        );
    }
}
