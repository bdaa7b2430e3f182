package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.certforge.model.shape.LaurelSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
@Slf4j
public class Laurels {

    public final int LEAF_COUNT = 12;
    private final int LEAF_HALF_WIDTH = 16;
    private final int LEAF_HALF_HEIGHT = 10;

    public void draw(Canvas canvas, LaurelSpec laurel) {
        for (Point2D.Double leaf : leaves(laurel)) {
            canvas.fillEllipse(leaf.x - LEAF_HALF_WIDTH, leaf.y - LEAF_HALF_HEIGHT,
                    leaf.x + LEAF_HALF_WIDTH, leaf.y + LEAF_HALF_HEIGHT, laurel.color());
        }
    }

    /**
     * Leaf centres on the wreath arc, stepping 10 degrees away from the top. Empty for an unknown side.
     */
    public List<Point2D.Double> leaves(LaurelSpec laurel) {
        boolean left = LaurelSpec.LEFT.equals(laurel.side());
        if (!left && !LaurelSpec.RIGHT.equals(laurel.side())) {
            log.debug("Ignoring laurel with unsupported side '{}'", laurel.side());
            return List.of();
        }
        double start = Math.toRadians(left ? 152 : 28);
        int direction = left ? -1 : 1;
        List<Point2D.Double> leaves = new ArrayList<>(LEAF_COUNT);
        for (int i = 0; i < LEAF_COUNT; i++) {
            double angle = start + direction * i * Math.toRadians(10);
            leaves.add(new Point2D.Double(
                    laurel.centerX() + Math.cos(angle) * laurel.radius(),
                    laurel.centerY() + Math.sin(angle) * laurel.radius()));
        }
        return leaves;
    }
}
