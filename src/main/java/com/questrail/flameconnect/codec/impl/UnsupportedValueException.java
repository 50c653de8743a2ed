package com.questrail.flameconnect.codec.impl;

import com.questrail.flameconnect.codec.ProtocolError;

/**
 * Raised by {@link FrameReader} when an enum-typed field holds a byte outside
 * the enum's domain. Never escapes this package: the decoder converts it into
 * a {@link ProtocolError.UnsupportedValue} result.
 */
final class UnsupportedValueException extends Exception
{
    private final ProtocolError.UnsupportedValue error;

    UnsupportedValueException(ProtocolError.UnsupportedValue error)
    {
        super(error.message());
        this.error = error;
    }

    ProtocolError.UnsupportedValue error()
    {
        return error;
    }
}
