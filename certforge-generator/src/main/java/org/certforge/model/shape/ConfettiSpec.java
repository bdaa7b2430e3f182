package org.certforge.model.shape;

import java.awt.Color;
import java.util.List;

/**
 * Scatter of {@code count} pieces anchored inside {@code bounds} (edges inclusive), colours drawn from
 * {@code palette}. The same seed always yields the same pieces.
 */
public record ConfettiSpec(Box bounds, int count, List<Color> palette, long seed) {

    public ConfettiSpec {
        if (count < 0) {
            throw new IllegalArgumentException("Confetti count must not be negative: " + count);
        }
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("Confetti palette must not be empty");
        }
        palette = List.copyOf(palette);
    }
}
