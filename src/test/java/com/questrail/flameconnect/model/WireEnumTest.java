package com.questrail.flameconnect.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WireEnumTest
{
    @Test
    void resolvesKnownValues()
    {
        assertEquals(HeatMode.FAN_ONLY, WireEnum.fromWire(HeatMode.class, 3).orElseThrow());
        assertEquals(MediaTheme.MIDNIGHT, WireEnum.fromWire(MediaTheme.class, 8).orElseThrow());
        assertEquals(FlameColor.BLUE_RED, WireEnum.fromWire(FlameColor.class, 6).orElseThrow());
    }

    @Test
    void rejectsOutOfDomainValues()
    {
        assertTrue(WireEnum.fromWire(FireMode.class, 2).isEmpty());
        assertTrue(WireEnum.fromWire(HeatControl.class, 255).isEmpty());
    }

    @Test
    void brightnessOrdinalsMatchWire()
    {
        assertEquals(0, Brightness.HIGH.wireValue());
        assertEquals(1, Brightness.LOW.wireValue());
    }
}
