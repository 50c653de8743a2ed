package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.ParameterKind;
import com.questrail.flameconnect.model.RGBWColor;
import com.questrail.flameconnect.model.WireEnum;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * FrameReader
 * -----------------------------------------------------------------------------
 * Absolute-offset field reader over one length-checked frame.
 *
 * <p>Offsets are frame offsets (the payload starts at 3). The reader never
 * moves a cursor, so decoders read fields in whatever order the record
 * layout lists them and skip padding simply by not reading it.</p>
 *
 * <p>The wrapped buffer is released on {@link #close()}.</p>
 */
final class FrameReader implements AutoCloseable
{
    private final ParameterKind kind;
    private final ByteBuf frame;

    FrameReader(ParameterKind kind, byte[] frame)
    {
        this.kind = kind;
        this.frame = Unpooled.wrappedBuffer(frame);
    }

    int u8(int offset)
    {
        return frame.getUnsignedByte(offset);
    }

    int u16le(int offset)
    {
        return frame.getUnsignedShortLE(offset);
    }

    double temperature(int offset)
    {
        return FixedPointTemperature.read(frame, offset);
    }

    /**
     * Reads four colour bytes stored in Red, Blue, Green, White order.
     */
    RGBWColor color(int offset)
    {
        final int red = u8(offset);
        final int blue = u8(offset + 1);
        final int green = u8(offset + 2);
        final int white = u8(offset + 3);
        return new RGBWColor(red, green, blue, white);
    }

    <E extends Enum<E> & WireEnum> E enumAt(int offset, Class<E> type, String field)
            throws UnsupportedValueException
    {
        return enumOf(u8(offset), type, field);
    }

    <E extends Enum<E> & WireEnum> E enumOf(int value, Class<E> type, String field)
            throws UnsupportedValueException
    {
        return WireEnum.fromWire(type, value).orElseThrow(() ->
                new UnsupportedValueException(new ProtocolError.UnsupportedValue(kind, field, value)));
    }

    @Override
    public void close()
    {
        frame.release();
    }
}
