package org.certforge.service.canvas;

import lombok.experimental.UtilityClass;

import java.awt.Color;

@UtilityClass
public class ColorBlender {

    /**
     * Linear interpolation per RGB channel, truncated toward zero. {@code t} is not clamped, so values outside
     * {@code [0, 1]} extrapolate; a channel pushed outside {@code [0, 255]} is rejected by {@link Color}.
     */
    public Color blend(Color start, Color end, double t) {
        return new Color(
                channel(start.getRed(), end.getRed(), t),
                channel(start.getGreen(), end.getGreen(), t),
                channel(start.getBlue(), end.getBlue(), t));
    }

    private int channel(int start, int end, double t) {
        return (int) (start + (end - start) * t);
    }
}
