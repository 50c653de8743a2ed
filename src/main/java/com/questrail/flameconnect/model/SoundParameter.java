package com.questrail.flameconnect.model;

/**
 * Volume and selected sound file (id 369).
 */
public record SoundParameter(int volume, int soundFile) implements WritableParameter
{
    @Override
    public ParameterKind kind()
    {
        return ParameterKind.SOUND;
    }
}
