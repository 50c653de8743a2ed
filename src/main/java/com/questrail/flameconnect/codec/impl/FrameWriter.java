package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.model.ParameterKind;
import com.questrail.flameconnect.model.RGBWColor;
import com.questrail.flameconnect.model.WireEnum;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * FrameWriter
 * -----------------------------------------------------------------------------
 * Sequential writer for one fixed-length frame.
 *
 * <p>The header is written on construction. The backing buffer is capped at
 * the kind's frame length, so a layout that writes too much fails loudly
 * instead of producing an oversized frame.</p>
 */
final class FrameWriter
{
    private final ParameterKind kind;
    private final ByteBuf out;

    FrameWriter(ParameterKind kind)
    {
        this.kind = kind;
        this.out = Unpooled.buffer(kind.frameLength(), kind.frameLength());
        FrameHeader.write(out, kind);
    }

    FrameWriter u8(int value)
    {
        out.writeByte(value);
        return this;
    }

    FrameWriter u16le(int value)
    {
        out.writeShortLE(value);
        return this;
    }

    FrameWriter wire(WireEnum value)
    {
        return u8(value.wireValue());
    }

    FrameWriter temperature(double value)
    {
        FixedPointTemperature.write(out, value);
        return this;
    }

    /**
     * Writes four colour bytes in Red, Blue, Green, White order.
     */
    FrameWriter color(RGBWColor color)
    {
        return u8(color.red())
                .u8(color.blue())
                .u8(color.green())
                .u8(color.white());
    }

    FrameWriter padding(int count)
    {
        out.writeZero(count);
        return this;
    }

    /**
     * Returns the completed frame.
     *
     * @throws IllegalStateException if the layout did not fill the frame exactly
     */
    byte[] toByteArray()
    {
        try {
            if (out.readableBytes() != kind.frameLength()) {
                throw new IllegalStateException(kind.displayName() + " frame is "
                        + out.readableBytes() + " bytes, expected " + kind.frameLength());
            }
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }
}
