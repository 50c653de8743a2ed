package com.questrail.flameconnect.codec;

import com.questrail.flameconnect.model.Parameter;
import com.questrail.flameconnect.model.ParameterKind;

/**
 * ParameterDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for FlameConnect parameter frames.
 *
 * <p>This interface defines the inbound boundary between raw frame bytes (as
 * produced by base64-decoding one {@code Value} of the cloud relay's
 * parameter list) and a structured {@link Parameter}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Resolving the parameter id to a kind</li>
 *   <li>Guarding the fixed frame length of that kind</li>
 *   <li>Reading fields at their fixed offsets into the matching variant</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Base64 or JSON envelope handling</li>
 *   <li>Logging, retrying or skipping failed entries</li>
 * </ul>
 *
 * <p>Implementations are stateless and safe for concurrent use.</p>
 */
public interface ParameterDecoder
{
    /**
     * Decode one full frame (header included) reported under {@code parameterId}.
     *
     * @param parameterId unsigned 16-bit id taken from the envelope
     * @param frame       complete frame bytes, header included
     * @return the decoded parameter, or
     *         {@link ProtocolError.UnknownParameter},
     *         {@link ProtocolError.InsufficientData} or
     *         {@link ProtocolError.UnsupportedValue}
     */
    CodecResult<Parameter> decode(int parameterId, byte[] frame);

    /**
     * Decode one full frame of a known kind.
     */
    default CodecResult<Parameter> decode(ParameterKind kind, byte[] frame)
    {
        return decode(kind.id(), frame);
    }
}
