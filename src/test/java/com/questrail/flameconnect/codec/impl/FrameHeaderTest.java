package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.ParameterKind;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static com.questrail.flameconnect.codec.impl.WireFrames.bytes;
import static org.junit.jupiter.api.Assertions.*;

final class FrameHeaderTest
{
    private static byte[] header(ParameterKind kind)
    {
        ByteBuf out = Unpooled.buffer(3);
        try {
            FrameHeader.write(out, kind);
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }

    @Test
    void headerIsLittleEndianIdThenPayloadLength()
    {
        assertArrayEquals(bytes(0x41, 0x01, 0x03), header(ParameterKind.MODE));
        assertArrayEquals(bytes(0x42, 0x01, 0x14), header(ParameterKind.FLAME_EFFECT));
        assertArrayEquals(bytes(0xEC, 0x00, 0x01), header(ParameterKind.TEMPERATURE_UNIT));
        assertArrayEquals(bytes(0x72, 0x01, 0x08), header(ParameterKind.LOG_EFFECT));
    }

    @Test
    void exactLengthPassesGuard()
    {
        assertTrue(FrameHeader.checkLength(ParameterKind.SOUND, new byte[5]).isEmpty());
        assertTrue(FrameHeader.checkLength(ParameterKind.SOUND, new byte[6]).isEmpty());
    }

    @Test
    void shortFrameFailsGuard()
    {
        assertEquals(new ProtocolError.InsufficientData(ParameterKind.SOUND, 5, 4),
                FrameHeader.checkLength(ParameterKind.SOUND, new byte[4]).orElseThrow());
    }
}
