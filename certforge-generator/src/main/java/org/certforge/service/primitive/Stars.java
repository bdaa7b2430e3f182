package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.StarSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class Stars {

    public final int VERTEX_COUNT = 10;

    public void draw(Canvas canvas, StarSpec star, Color fill) {
        canvas.fillPolygon(vertices(star), fill);
    }

    /**
     * Five-pointed star outline: even vertices on the outer radius, odd ones on the inner radius,
     * the first one straight above the centre.
     */
    public List<Point2D.Double> vertices(StarSpec star) {
        List<Point2D.Double> points = new ArrayList<>(VERTEX_COUNT);
        for (int i = 0; i < VERTEX_COUNT; i++) {
            double angle = -Math.PI / 2 + i * Math.PI / 5;
            int radius = i % 2 == 0 ? star.outerRadius() : star.innerRadius();
            points.add(new Point2D.Double(
                    star.centerX() + Math.cos(angle) * radius,
                    star.centerY() + Math.sin(angle) * radius));
        }
        return points;
    }
}
