package com.questrail.flameconnect.model;

/**
 * Firmware versions of the three appliance subsystems (id 327). Read-only.
 */
public record SoftwareVersionParameter(
        int uiMajor,
        int uiMinor,
        int uiTest,
        int controlMajor,
        int controlMinor,
        int controlTest,
        int relayMajor,
        int relayMinor,
        int relayTest
) implements ReadOnlyParameter
{
    @Override
    public ParameterKind kind()
    {
        return ParameterKind.SOFTWARE_VERSION;
    }

    public String uiVersion()
    {
        return uiMajor + "." + uiMinor + "." + uiTest;
    }

    public String controlVersion()
    {
        return controlMajor + "." + controlMinor + "." + controlTest;
    }

    public String relayVersion()
    {
        return relayMajor + "." + relayMinor + "." + relayTest;
    }
}
