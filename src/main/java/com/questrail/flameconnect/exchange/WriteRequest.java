package com.questrail.flameconnect.exchange;

import java.util.List;
import java.util.Objects;

/**
 * Body of a parameter write:
 * {@code { "FireId": <id>, "Parameters": [ { "ParameterId", "Value" }, ... ] }}.
 *
 * <p>JSON serialization is left to the transport.</p>
 */
public record WriteRequest(String fireId, List<WireParameter> parameters)
{
    public WriteRequest {
        Objects.requireNonNull(fireId, "fireId");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
    }
}
