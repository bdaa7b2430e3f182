package org.certforge.model.shape;

import java.awt.Color;

/**
 * Half of a laurel wreath. {@code side} is {@code "left"} or {@code "right"}; anything else draws nothing.
 */
public record LaurelSpec(int centerX, int centerY, int radius, Color color, String side) {

    public static final String LEFT = "left";
    public static final String RIGHT = "right";
}
