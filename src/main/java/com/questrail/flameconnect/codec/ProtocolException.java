package com.questrail.flameconnect.codec;

import java.util.Objects;

/**
 * Unchecked carrier for a {@link ProtocolError}, raised only where a caller
 * explicitly asks to abort, e.g. {@link CodecResult#orElseThrow()}.
 */
public final class ProtocolException extends RuntimeException
{
    private final transient ProtocolError error;

    public ProtocolException(ProtocolError error)
    {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ProtocolException(ProtocolError error, Throwable cause)
    {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ProtocolError error()
    {
        return error;
    }
}
