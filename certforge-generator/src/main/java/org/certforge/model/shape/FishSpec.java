package org.certforge.model.shape;

import java.awt.Color;

/**
 * Fish silhouette anchored at its nose. A mirrored fish swims to the left.
 */
public record FishSpec(int x, int y, int size, Color color, boolean mirrored) {
}
