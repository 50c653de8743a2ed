package com.questrail.flameconnect.exchange;

import java.util.Objects;

/**
 * One entry of the cloud relay's parameter list:
 * {@code { "ParameterId": <uint16>, "Value": <base64> }}.
 *
 * @param value base64 encoding of the complete frame, header included
 */
public record WireParameter(int parameterId, String value)
{
    public WireParameter {
        Objects.requireNonNull(value, "value");
    }
}
