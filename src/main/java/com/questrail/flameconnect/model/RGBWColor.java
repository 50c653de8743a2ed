package com.questrail.flameconnect.model;

/**
 * RGBW colour value with four independent 0–255 intensity channels.
 *
 * <p>No clamping or validation is applied; callers supply in-range values.
 * The wire stores channels in Red, Blue, Green, White order. This type always
 * holds them in Red, Green, Blue, White order.</p>
 */
public record RGBWColor(int red, int green, int blue, int white)
{
    public static final RGBWColor OFF = new RGBWColor(0, 0, 0, 0);
}
