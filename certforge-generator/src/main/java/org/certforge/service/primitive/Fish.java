package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.FishSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.List;

@UtilityClass
public class Fish {

    private final Color EYE = new Color(255, 255, 255, 230);
    private final int EYE_RADIUS = 5;

    public void draw(Canvas canvas, FishSpec fish) {
        canvas.fillPolygon(body(fish), fish.color());
        canvas.fillPolygon(tail(fish), fish.color());
        Point2D.Double eye = eye(fish);
        int ex = (int) eye.x;
        int ey = (int) eye.y;
        canvas.fillEllipse(new Box(ex - EYE_RADIUS, ey - EYE_RADIUS, ex + EYE_RADIUS, ey + EYE_RADIUS), EYE);
    }

    public List<Point2D.Double> body(FishSpec fish) {
        int d = direction(fish);
        int x = fish.x();
        int y = fish.y();
        return List.of(
                new Point2D.Double(x, y),
                new Point2D.Double(x + d * scale(fish, 0.8), y - scale(fish, 0.35)),
                new Point2D.Double(x + d * scale(fish, 1.45), y),
                new Point2D.Double(x + d * scale(fish, 0.8), y + scale(fish, 0.35)));
    }

    public List<Point2D.Double> tail(FishSpec fish) {
        int d = direction(fish);
        int x = fish.x();
        int y = fish.y();
        return List.of(
                new Point2D.Double(x + d * scale(fish, 1.45), y),
                new Point2D.Double(x + d * scale(fish, 1.95), y - scale(fish, 0.5)),
                new Point2D.Double(x + d * scale(fish, 1.95), y + scale(fish, 0.5)));
    }

    public Point2D.Double eye(FishSpec fish) {
        return new Point2D.Double(fish.x() + direction(fish) * scale(fish, 0.2), fish.y() - scale(fish, 0.08));
    }

    private int direction(FishSpec fish) {
        return fish.mirrored() ? -1 : 1;
    }

    private int scale(FishSpec fish, double factor) {
        return (int) (fish.size() * factor);
    }
}
