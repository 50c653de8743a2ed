package com.questrail.flameconnect.codec;

import com.questrail.flameconnect.model.Parameter;

/**
 * ParameterEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for FlameConnect parameter frames.
 *
 * <p>This is the outbound inverse of {@link ParameterDecoder}. The returned
 * frame always has exactly the fixed frame length of the parameter's kind
 * and is suitable for base64 encoding by the transport without further
 * modification.</p>
 */
public interface ParameterEncoder
{
    /**
     * Encode a parameter into its complete wire frame.
     *
     * @return the frame bytes, or {@link ProtocolError.ReadOnly} for kinds the
     *         appliance only reports
     */
    CodecResult<byte[]> encode(Parameter parameter);
}
