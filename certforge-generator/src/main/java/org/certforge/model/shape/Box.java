package org.certforge.model.shape;

/**
 * Axis-aligned rectangle given by its edges in canvas pixels, {@code right} and {@code bottom} exclusive.
 */
public record Box(int left, int top, int right, int bottom) {

    public Box {
        if (right < left || bottom < top) {
            throw new IllegalArgumentException("Inverted box: " + left + "," + top + "," + right + "," + bottom);
        }
    }

    public static Box ofSize(int left, int top, int width, int height) {
        return new Box(left, top, left + width, top + height);
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }

    public Box translate(int dx, int dy) {
        return new Box(left + dx, top + dy, right + dx, bottom + dy);
    }

    public Box union(Box other) {
        return new Box(Math.min(left, other.left), Math.min(top, other.top),
                Math.max(right, other.right), Math.max(bottom, other.bottom));
    }

    public boolean contains(int x, int y) {
        return x >= left && x < right && y >= top && y < bottom;
    }
}
