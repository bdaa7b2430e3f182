package org.certforge.model.shape;

public record MedalSpec(int centerX, int centerY, int radius) {
}
