package org.certforge.model.shape;

import java.awt.Color;

public record ConfettiPiece(int x, int y, int width, int height, Color color, boolean rectangle) {

    public Box extent() {
        return Box.ofSize(x, y, width, height);
    }
}
