package org.certforge.model.shape;

import java.awt.Color;

/**
 * Burst of straight rays from {@code innerRadius} to {@code outerRadius} around a centre, one ray every
 * {@code stepDegrees} from {@code fromDegrees} up to, but excluding, {@code toDegrees}.
 */
public record RaySpec(int centerX, int centerY, int innerRadius, int outerRadius,
                      int fromDegrees, int toDegrees, int stepDegrees, Color color, int width) {

    public RaySpec {
        if (stepDegrees <= 0) {
            throw new IllegalArgumentException("Ray step must be positive: " + stepDegrees);
        }
    }
}
