package org.certforge.service.variant;

import org.certforge.model.Palette;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.ConfettiSpec;
import org.certforge.model.shape.RaySpec;
import org.certforge.model.shape.StarSpec;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.panel.PrizePanelLayout;
import org.certforge.service.panel.RecordPanelLayout;
import org.certforge.service.primitive.Checkerboard;
import org.certforge.service.primitive.Confetti;
import org.certforge.service.primitive.Rays;
import org.certforge.service.primitive.Stars;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * Comic-book theme: checkerboard, radiating speed lines, lightning bolts and speech balloons.
 */
@Component
public class SwimHeroRecipe extends VariantRecipe {

    static final Palette RECORD_PALETTE = Palette.builder()
            .panel(59, 121, 226)
            .accent(41, 146, 210)
            .header(213, 239, 255)
            .soft(241, 250, 255)
            .line(152, 198, 238)
            .build();

    static final Palette PRIZE_PALETTE = Palette.builder()
            .panel(59, 121, 226)
            .accent(41, 146, 210)
            .soft(241, 250, 255)
            .build();

    private static final int SQUARE = 120;
    private static final Color BOLT = rgba(255, 242, 120, 220);
    private static final Color BALLOON = rgba(255, 255, 255, 208);
    private static final Color BALLOON_OUTLINE = rgba(43, 126, 217, 215);

    private static final ConfettiSpec PRIZE_CONFETTI = new ConfettiSpec(
            new Box(270, 180, 2220, 1120),
            95,
            List.of(rgba(255, 233, 92, 230), rgba(255, 124, 109, 225), rgba(83, 175, 255, 225), rgba(255, 255, 255, 200)),
            812);

    public SwimHeroRecipe(RecordPanelLayout recordLayout, PrizePanelLayout prizeLayout) {
        super(recordLayout, prizeLayout);
    }

    @Override
    public TemplateVariant getVariant() {
        return TemplateVariant.SWIM_HERO;
    }

    @Override
    public Palette palette(CertificateType type) {
        return type == CertificateType.RECORD ? RECORD_PALETTE : PRIZE_PALETTE;
    }

    @Override
    protected Canvas paintRecordArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(155, 246, 228), rgb(67, 175, 255));

        Checkerboard.draw(canvas, SQUARE, rgba(255, 255, 255, 35));
        Rays.draw(canvas, new RaySpec(1240, 420, 200, 2100, -85, 266, 9, rgba(255, 255, 255, 82), 6));

        canvas.fillPolygon(points(190, 500, 400, 430, 340, 660, 510, 740, 220, 870, 290, 650), BOLT);
        canvas.fillPolygon(points(2160, 680, 1960, 780, 2030, 980, 1840, 1020, 2050, 1230, 2020, 940), BOLT);

        canvas.fillEllipse(new Box(210, 2390, 640, 2670), BALLOON, BALLOON_OUTLINE, 8);
        canvas.fillPolygon(points(520, 2570, 690, 2640, 540, 2690), BALLOON, BALLOON_OUTLINE);
        canvas.fillEllipse(new Box(1840, 2580, 2260, 2840), BALLOON, BALLOON_OUTLINE, 8);
        canvas.fillPolygon(points(1960, 2820, 1830, 2940, 2050, 2890), BALLOON, BALLOON_OUTLINE);
        return canvas;
    }

    @Override
    protected Canvas paintPrizeArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(165, 246, 228), rgb(62, 168, 255));

        Checkerboard.draw(canvas, SQUARE, rgba(255, 255, 255, 32));
        Rays.draw(canvas, new RaySpec(1240, 340, 240, 2160, -85, 266, 8, rgba(255, 255, 255, 86), 7));

        canvas.fillEllipse(new Box(1020, 210, 1460, 650), rgba(255, 94, 88, 240), rgba(197, 56, 61, 255), 12);
        canvas.fillEllipse(new Box(1100, 290, 1380, 570), rgba(255, 233, 91, 245));
        Stars.draw(canvas, new StarSpec(1240, 430, 95, 40), rgba(255, 111, 98, 250));

        Confetti.draw(canvas, PRIZE_CONFETTI);
        return canvas;
    }

    private static List<Point2D.Double> points(int... coordinates) {
        Point2D.Double[] points = new Point2D.Double[coordinates.length / 2];
        for (int i = 0; i < points.length; i++) {
            points[i] = new Point2D.Double(coordinates[2 * i], coordinates[2 * i + 1]);
        }
        return List.of(points);
    }
}
