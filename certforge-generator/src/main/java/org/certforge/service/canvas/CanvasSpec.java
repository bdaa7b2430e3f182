package org.certforge.service.canvas;

public record CanvasSpec(int width, int height) {

    public static final CanvasSpec A4_300_DPI = new CanvasSpec(2480, 3508);

    public CanvasSpec {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive: " + width + "x" + height);
        }
    }
}
