package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;

@UtilityClass
public class Checkerboard {

    /**
     * Tints every square whose column and row indices sum to an even number, starting from the top-left corner.
     */
    public void draw(Canvas canvas, int square, Color tint) {
        if (square <= 0) {
            throw new IllegalArgumentException("Checkerboard square must be positive: " + square);
        }
        for (int y = 0; y < canvas.height(); y += square) {
            for (int x = 0; x < canvas.width(); x += square) {
                if ((x / square + y / square) % 2 == 0) {
                    canvas.fillRect(Box.ofSize(x, y, square, square), tint);
                }
            }
        }
    }
}
