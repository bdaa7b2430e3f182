package org.certforge.model.shape;

public record StarSpec(int centerX, int centerY, int outerRadius, int innerRadius) {
}
