package com.questrail.flameconnect.codec.impl;

import io.netty.buffer.ByteBuf;

/**
 * FixedPointTemperature
 * -----------------------------------------------------------------------------
 * Two-byte fixed-point temperature: integer part, then the tenths digit.
 *
 * <pre>
 *   22.5  ->  [ 0x16, 0x05 ]
 * </pre>
 *
 * <p>Values are expected to be multiples of 0.1 in {@code [0, 255.9]}.
 * Anything outside that range wraps silently in the integer byte; range
 * checking belongs to the caller.</p>
 */
final class FixedPointTemperature
{
    private FixedPointTemperature() {}

    static double read(ByteBuf frame, int offset)
    {
        return frame.getUnsignedByte(offset) + frame.getUnsignedByte(offset + 1) / 10.0;
    }

    static void write(ByteBuf out, double value)
    {
        // Scale first so 22.7 (0.6999... after modulo) still yields digit 7.
        final long tenths = Math.round(value * 10.0);
        out.writeByte((int) Math.floorDiv(tenths, 10L));
        out.writeByte((int) Math.floorMod(tenths, 10L));
    }
}
