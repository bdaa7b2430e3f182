package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.MedalSpec;
import org.certforge.model.shape.StarSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.List;

@UtilityClass
public class Medals {

    private final Color LEFT_RIBBON = new Color(39, 122, 223, 220);
    private final Color RIGHT_RIBBON = new Color(29, 178, 232, 220);
    private final Color DISC = new Color(255, 217, 94, 255);
    private final Color DISC_OUTLINE = new Color(240, 166, 34, 255);
    private final Color RING = new Color(255, 244, 171, 240);
    private final Color STAR = new Color(255, 247, 191, 255);

    public void draw(Canvas canvas, MedalSpec medal) {
        int cx = medal.centerX();
        int cy = medal.centerY();
        int r = medal.radius();

        canvas.fillPolygon(ribbon(cx, cy, r, -1), LEFT_RIBBON);
        canvas.fillPolygon(ribbon(cx, cy, r, 1), RIGHT_RIBBON);
        canvas.fillEllipse(new Box(cx - r, cy - r, cx + r, cy + r), DISC, DISC_OUTLINE, 12);
        canvas.drawEllipse(new Box(cx - r + 26, cy - r + 26, cx + r - 26, cy + r - 26), RING, 8);
        Stars.draw(canvas, new StarSpec(cx, cy, 36, 16), STAR);
    }

    private List<Point2D.Double> ribbon(int cx, int cy, int r, int side) {
        return List.of(
                new Point2D.Double(cx + side * 52, cy - r - 130),
                new Point2D.Double(cx + side * 14, cy - r - 26),
                new Point2D.Double(cx + side * 90, cy - r - 26));
    }
}
