package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.CodecResult;
import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.questrail.flameconnect.codec.impl.WireFrames.bytes;
import static com.questrail.flameconnect.codec.impl.WireFrames.frame;
import static com.questrail.flameconnect.codec.impl.WireFrames.zeroFrame;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultParameterDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultParameterDecoder}.
 *
 * <p>These tests feed hand-built frames and check field extraction, the
 * layout quirks (colour order, speed indexing, padding) and the error
 * taxonomy. No encoder is involved.</p>
 */
final class DefaultParameterDecoderTest
{
    private final DefaultParameterDecoder decoder = new DefaultParameterDecoder();

    @Test
    void decodeModeFrame()
    {
        byte[] raw = bytes(0x41, 0x01, 0x03, 0x01, 0x16, 0x05);

        Parameter decoded = decoder.decode(321, raw).orElseThrow();

        assertEquals(new ModeParameter(FireMode.MANUAL, 22.5), decoded);
    }

    @Test
    void decodeTemperatureUnit()
    {
        Parameter celsius = decoder.decode(ParameterKind.TEMPERATURE_UNIT,
                frame(ParameterKind.TEMPERATURE_UNIT, 1)).orElseThrow();
        Parameter fahrenheit = decoder.decode(ParameterKind.TEMPERATURE_UNIT,
                frame(ParameterKind.TEMPERATURE_UNIT, 0)).orElseThrow();

        assertEquals(new TemperatureUnitParameter(TemperatureUnit.CELSIUS), celsius);
        assertEquals(new TemperatureUnitParameter(TemperatureUnit.FAHRENHEIT), fahrenheit);
    }

    @Test
    void decodeFlameEffectFields()
    {
        byte[] raw = frame(ParameterKind.FLAME_EFFECT,
                1,                  // effect ON
                2,                  // speed (wire 0-based)
                0b01,               // brightness LOW, pulsating OFF
                7,                  // KALEIDOSCOPE
                1,                  // media light ON
                100, 50, 75, 25,    // media colour R,B,G,W
                0,                  // padding
                1,                  // overhead light ON
                200, 150, 175, 125, // overhead colour R,B,G,W
                1,                  // light status
                3,                  // flame colour BLUE
                0, 0,               // padding
                0);                 // ambient sensor OFF

        FlameEffectParameter p = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();

        assertEquals(FlameEffect.ON, p.flameEffect());
        assertEquals(3, p.flameSpeed());
        assertEquals(Brightness.LOW, p.brightness());
        assertEquals(PulsatingEffect.OFF, p.pulsatingEffect());
        assertEquals(MediaTheme.KALEIDOSCOPE, p.mediaTheme());
        assertEquals(LightStatus.ON, p.mediaLight());
        assertEquals(new RGBWColor(100, 75, 50, 25), p.mediaColor());
        assertEquals(LightStatus.ON, p.overheadLight());
        assertEquals(new RGBWColor(200, 175, 150, 125), p.overheadColor());
        assertEquals(LightStatus.ON, p.lightStatus());
        assertEquals(FlameColor.BLUE, p.flameColor());
        assertEquals(LightStatus.OFF, p.ambientSensor());
    }

    @Test
    void colorChannelsAreReorderedFromWireOrder()
    {
        byte[] raw = zeroFrame(ParameterKind.FLAME_EFFECT);
        raw[8] = 10;  // red
        raw[9] = 20;  // blue
        raw[10] = 30; // green
        raw[11] = 40; // white

        FlameEffectParameter p = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();

        assertEquals(10, p.mediaColor().red());
        assertEquals(30, p.mediaColor().green());
        assertEquals(20, p.mediaColor().blue());
        assertEquals(40, p.mediaColor().white());
    }

    @Test
    void logEffectColorIsReorderedFromWireOrder()
    {
        byte[] raw = frame(ParameterKind.LOG_EFFECT, 1, 0, 10, 20, 30, 40, 5, 0);

        LogEffectParameter p = (LogEffectParameter) decoder.decode(370, raw).orElseThrow();

        assertEquals(new LogEffectParameter(LogEffect.ON, new RGBWColor(10, 30, 20, 40), 5), p);
    }

    @Test
    void flameSpeedIsOneBased()
    {
        byte[] raw = zeroFrame(ParameterKind.FLAME_EFFECT);

        raw[4] = 0;
        assertEquals(1, ((FlameEffectParameter) decoder.decode(322, raw).orElseThrow()).flameSpeed());
        raw[4] = 2;
        assertEquals(3, ((FlameEffectParameter) decoder.decode(322, raw).orElseThrow()).flameSpeed());
        raw[4] = 4;
        assertEquals(5, ((FlameEffectParameter) decoder.decode(322, raw).orElseThrow()).flameSpeed());
    }

    @Test
    void brightnessAndPulsatingShareOneByte()
    {
        byte[] raw = zeroFrame(ParameterKind.FLAME_EFFECT);

        raw[5] = 0b10;
        FlameEffectParameter pulsating = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();
        assertEquals(Brightness.HIGH, pulsating.brightness());
        assertEquals(PulsatingEffect.ON, pulsating.pulsatingEffect());

        raw[5] = 0b11;
        FlameEffectParameter both = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();
        assertEquals(Brightness.LOW, both.brightness());
        assertEquals(PulsatingEffect.ON, both.pulsatingEffect());
    }

    @Test
    void paddingBytesAreIgnored()
    {
        byte[] clean = zeroFrame(ParameterKind.FLAME_EFFECT);
        byte[] dirty = clean.clone();
        dirty[12] = 99;
        dirty[20] = 99;
        dirty[21] = 99;

        assertEquals(decoder.decode(322, clean).orElseThrow(), decoder.decode(322, dirty).orElseThrow());

        byte[] logClean = zeroFrame(ParameterKind.LOG_EFFECT);
        byte[] logDirty = logClean.clone();
        logDirty[4] = 6;   // theme
        logDirty[10] = 99; // padding

        assertEquals(decoder.decode(370, logClean).orElseThrow(), decoder.decode(370, logDirty).orElseThrow());
    }

    @Test
    void flameColorIsReadFromOffsetNineteen()
    {
        byte[] raw = zeroFrame(ParameterKind.FLAME_EFFECT);
        raw[19] = 3;
        raw[20] = 99;

        FlameEffectParameter p = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();
        assertEquals(FlameColor.BLUE, p.flameColor());
    }

    @Test
    void decodeHeatSettingsLittleEndianBoost()
    {
        byte[] raw = frame(ParameterKind.HEAT_SETTINGS, 1, 1, 25, 5, 0x2C, 0x01);

        Parameter decoded = decoder.decode(323, raw).orElseThrow();

        assertEquals(new HeatSettingsParameter(HeatStatus.ON, HeatMode.BOOST, 25.5, 300), decoded);
    }

    @Test
    void decodeHeatMode()
    {
        Parameter decoded = decoder.decode(325, frame(ParameterKind.HEAT_MODE, 2)).orElseThrow();
        assertEquals(new HeatModeParameter(HeatControl.ENABLED), decoded);
    }

    @Test
    void decodeTimerLittleEndianDuration()
    {
        Parameter decoded = decoder.decode(326, frame(ParameterKind.TIMER, 1, 0xE8, 0x03)).orElseThrow();
        assertEquals(new TimerParameter(TimerStatus.ENABLED, 1000), decoded);

        Parameter max = decoder.decode(326, frame(ParameterKind.TIMER, 0, 0xFF, 0xFF)).orElseThrow();
        assertEquals(new TimerParameter(TimerStatus.DISABLED, 65535), max);
    }

    @Test
    void decodeSoftwareVersion()
    {
        byte[] raw = frame(ParameterKind.SOFTWARE_VERSION, 1, 2, 3, 4, 5, 6, 7, 8, 9);

        SoftwareVersionParameter p = (SoftwareVersionParameter) decoder.decode(327, raw).orElseThrow();

        assertEquals(new SoftwareVersionParameter(1, 2, 3, 4, 5, 6, 7, 8, 9), p);
        assertEquals("1.2.3", p.uiVersion());
        assertEquals("4.5.6", p.controlVersion());
        assertEquals("7.8.9", p.relayVersion());
    }

    @Test
    void decodeErrorFlags()
    {
        byte[] raw = frame(ParameterKind.ERROR, 0xFF, 0x01, 0x80, 0x42);

        ErrorParameter p = (ErrorParameter) decoder.decode(329, raw).orElseThrow();

        assertEquals(new ErrorParameter(0xFF, 0x01, 0x80, 0x42), p);
        assertTrue(p.hasFault());
        assertFalse(((ErrorParameter) decoder.decode(329, zeroFrame(ParameterKind.ERROR)).orElseThrow()).hasFault());
    }

    @Test
    void decodeSound()
    {
        Parameter decoded = decoder.decode(369, frame(ParameterKind.SOUND, 128, 1)).orElseThrow();
        assertEquals(new SoundParameter(128, 1), decoded);
    }

    @Test
    void trailingBytesBeyondFrameLengthAreIgnored()
    {
        byte[] raw = bytes(0x41, 0x01, 0x03, 0x00, 0x14, 0x00, 0x7F, 0x7F);

        assertEquals(new ModeParameter(FireMode.STANDBY, 20.0), decoder.decode(321, raw).orElseThrow());
    }

    @Test
    void truncatedFrameYieldsInsufficientDataForEveryKind()
    {
        for (ParameterKind kind : ParameterKind.values()) {
            byte[] shortFrame = Arrays.copyOf(zeroFrame(kind), kind.frameLength() - 1);

            CodecResult<Parameter> result = decoder.decode(kind.id(), shortFrame);

            assertTrue(result.isFailure(), kind.name());
            assertEquals(new ProtocolError.InsufficientData(kind, kind.frameLength(), kind.frameLength() - 1),
                    result.error().orElseThrow(), kind.name());
        }
    }

    @Test
    void emptyFrameYieldsInsufficientData()
    {
        CodecResult<Parameter> result = decoder.decode(329, new byte[0]);

        ProtocolError error = result.error().orElseThrow();
        assertInstanceOf(ProtocolError.InsufficientData.class, error);
        assertEquals("Insufficient data for Error: expected 7 bytes, got 0", error.message());
    }

    @Test
    void unknownParameterIdIsRejected()
    {
        CodecResult<Parameter> result = decoder.decode(9999, bytes(0x0F, 0x27, 0x01, 0x00));

        assertEquals(new ProtocolError.UnknownParameter(9999), result.error().orElseThrow());
        assertEquals("Unknown parameter ID: 9999", result.error().orElseThrow().message());
    }

    @Test
    void outOfDomainEnumByteIsReported()
    {
        CodecResult<Parameter> result = decoder.decode(325, frame(ParameterKind.HEAT_MODE, 7));

        assertEquals(new ProtocolError.UnsupportedValue(ParameterKind.HEAT_MODE, "heatControl", 7),
                result.error().orElseThrow());
    }

    @Test
    void integerFieldsAcceptEveryByteValue()
    {
        byte[] raw = zeroFrame(ParameterKind.FLAME_EFFECT);
        raw[4] = (byte) 0xFF;

        FlameEffectParameter p = (FlameEffectParameter) decoder.decode(322, raw).orElseThrow();
        assertEquals(256, p.flameSpeed());
    }

    @Test
    void nullFrameIsRejected()
    {
        assertThrows(NullPointerException.class, () -> decoder.decode(321, null));
    }
}
