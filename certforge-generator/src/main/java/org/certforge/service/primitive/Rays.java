package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.RaySpec;
import org.certforge.service.canvas.Canvas;

@UtilityClass
public class Rays {

    public void draw(Canvas canvas, RaySpec rays) {
        for (int degrees = rays.fromDegrees(); degrees < rays.toDegrees(); degrees += rays.stepDegrees()) {
            double rad = Math.toRadians(degrees);
            double cos = Math.cos(rad);
            double sin = Math.sin(rad);
            canvas.drawLine(
                    rays.centerX() + cos * rays.innerRadius(), rays.centerY() + sin * rays.innerRadius(),
                    rays.centerX() + cos * rays.outerRadius(), rays.centerY() + sin * rays.outerRadius(),
                    rays.color(), rays.width());
        }
    }

    public int count(RaySpec rays) {
        int span = rays.toDegrees() - rays.fromDegrees();
        return span <= 0 ? 0 : (span + rays.stepDegrees() - 1) / rays.stepDegrees();
    }
}
