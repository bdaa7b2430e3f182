package org.certforge.service.variant;

import org.certforge.model.Palette;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.ConfettiSpec;
import org.certforge.model.shape.LaurelSpec;
import org.certforge.model.shape.StarSpec;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.panel.PrizePanelLayout;
import org.certforge.service.panel.RecordPanelLayout;
import org.certforge.service.primitive.Confetti;
import org.certforge.service.primitive.Laurels;
import org.certforge.service.primitive.Stars;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * Festival theme: warm side bands, a laurel wreath around a gold medal and confetti.
 */
@Component
public class MedalFesRecipe extends VariantRecipe {

    static final Palette RECORD_PALETTE = Palette.builder()
            .panel(237, 132, 47)
            .accent(231, 103, 70)
            .header(255, 233, 187)
            .soft(255, 247, 227)
            .line(241, 198, 133)
            .build();

    static final Palette PRIZE_PALETTE = Palette.builder()
            .panel(237, 132, 47)
            .accent(231, 103, 70)
            .soft(255, 247, 227)
            .build();

    private static final int BAND_WIDTH = 320;
    private static final Color BAND = rgba(255, 166, 122, 135);

    private static final ConfettiSpec RECORD_CONFETTI = new ConfettiSpec(
            new Box(350, 2420, 2140, 3260),
            65,
            List.of(rgba(255, 187, 120, 205), rgba(255, 214, 143, 205), rgba(250, 154, 129, 215), rgba(255, 241, 207, 210)),
            219);

    private static final ConfettiSpec PRIZE_CONFETTI = new ConfettiSpec(
            new Box(260, 180, 2240, 1260),
            110,
            List.of(rgba(255, 190, 115, 220), rgba(245, 102, 83, 220), rgba(104, 160, 242, 220), rgba(255, 234, 177, 215)),
            456);

    public MedalFesRecipe(RecordPanelLayout recordLayout, PrizePanelLayout prizeLayout) {
        super(recordLayout, prizeLayout);
    }

    @Override
    public TemplateVariant getVariant() {
        return TemplateVariant.MEDAL_FES;
    }

    @Override
    public Palette palette(CertificateType type) {
        return type == CertificateType.RECORD ? RECORD_PALETTE : PRIZE_PALETTE;
    }

    @Override
    protected Canvas paintRecordArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(255, 244, 190), rgb(255, 195, 144));

        paintSideBands(canvas);
        paintChevrons(canvas);

        Color leaves = rgba(97, 174, 92, 205);
        Laurels.draw(canvas, new LaurelSpec(1240, 500, 320, leaves, LaurelSpec.LEFT));
        Laurels.draw(canvas, new LaurelSpec(1240, 500, 320, leaves, LaurelSpec.RIGHT));
        canvas.fillEllipse(new Box(1090, 310, 1390, 610), rgba(255, 207, 90, 255), rgba(230, 150, 40, 255), 12);
        Stars.draw(canvas, new StarSpec(1240, 460, 70, 30), rgba(255, 246, 186, 240));

        Confetti.draw(canvas, RECORD_CONFETTI);
        return canvas;
    }

    @Override
    protected Canvas paintPrizeArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(255, 244, 189), rgb(255, 186, 137));

        paintSideBands(canvas);
        canvas.fillPolygon(triangle(470, 170, 620, 520, 770, 170), rgba(242, 92, 70, 220));
        canvas.fillPolygon(triangle(1710, 170, 1860, 520, 2010, 170), rgba(66, 134, 231, 220));

        Color leaves = rgba(97, 174, 92, 210);
        Laurels.draw(canvas, new LaurelSpec(1240, 600, 360, leaves, LaurelSpec.LEFT));
        Laurels.draw(canvas, new LaurelSpec(1240, 600, 360, leaves, LaurelSpec.RIGHT));
        canvas.fillEllipse(new Box(1030, 290, 1450, 710), rgba(255, 208, 96, 255), rgba(228, 145, 33, 255), 14);
        canvas.fillEllipse(new Box(1108, 368, 1372, 632), rgba(255, 240, 176, 250));
        Stars.draw(canvas, new StarSpec(1240, 500, 94, 40), rgba(255, 198, 52, 255));

        Confetti.draw(canvas, PRIZE_CONFETTI);
        return canvas;
    }

    private void paintSideBands(Canvas canvas) {
        canvas.fillRect(new Box(0, 0, BAND_WIDTH, canvas.height()), BAND);
        canvas.fillRect(new Box(canvas.width() - BAND_WIDTH, 0, canvas.width(), canvas.height()), BAND);
    }

    // Chevrons pointing inwards from both edges.
    private void paintChevrons(Canvas canvas) {
        Color chevron = rgba(255, 214, 170, 120);
        int w = canvas.width();
        for (int y = 200; y < 3400; y += 230) {
            canvas.fillPolygon(triangle(0, y, 170, y + 115, 0, y + 230), chevron);
            canvas.fillPolygon(triangle(w, y, w - 170, y + 115, w, y + 230), chevron);
        }
    }

    private static List<Point2D.Double> triangle(int x1, int y1, int x2, int y2, int x3, int y3) {
        return List.of(new Point2D.Double(x1, y1), new Point2D.Double(x2, y2), new Point2D.Double(x3, y3));
    }
}
