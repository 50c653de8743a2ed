package com.questrail.flameconnect.model;

/**
 * Raw fault flags reported by the appliance (id 329). Read-only.
 *
 * <p>The four bytes form an opaque bitmask and are not interpreted further.</p>
 */
public record ErrorParameter(int byte1, int byte2, int byte3, int byte4) implements ReadOnlyParameter
{
    @Override
    public ParameterKind kind()
    {
        return ParameterKind.ERROR;
    }

    /**
     * True when any fault bit is set.
     */
    public boolean hasFault()
    {
        return (byte1 | byte2 | byte3 | byte4) != 0;
    }
}
