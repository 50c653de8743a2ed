package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.ProtocolError;
import com.questrail.flameconnect.model.ParameterKind;
import io.netty.buffer.ByteBuf;

import java.util.Optional;

/**
 * FrameHeader
 * -----------------------------------------------------------------------------
 * The 3-byte header every parameter frame starts with, and the length guard
 * every reader applies before touching the payload.
 *
 * <pre>
 *   byte 0..1 : parameter id, unsigned 16-bit little-endian
 *   byte 2    : payload length, unsigned 8-bit (header not included)
 * </pre>
 *
 * <p>Decoding does not read the header: the id arrives out-of-band in the
 * envelope, and the fixed frame length of the kind is checked instead of the
 * declared payload length.</p>
 */
final class FrameHeader
{
    private FrameHeader() {}

    /**
     * Writes the header for {@code kind} at the buffer's writer index.
     */
    static void write(ByteBuf out, ParameterKind kind)
    {
        out.writeShortLE(kind.id());
        out.writeByte(kind.payloadLength());
    }

    /**
     * Returns {@link ProtocolError.InsufficientData} when {@code frame} is
     * shorter than the kind's fixed frame length. Longer frames are accepted;
     * trailing bytes are never read.
     */
    static Optional<ProtocolError> checkLength(ParameterKind kind, byte[] frame)
    {
        if (frame.length < kind.frameLength()) {
            return Optional.of(new ProtocolError.InsufficientData(kind, kind.frameLength(), frame.length));
        }
        return Optional.empty();
    }
}
