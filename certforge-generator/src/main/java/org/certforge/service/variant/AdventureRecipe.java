package org.certforge.service.variant;

import org.certforge.model.Palette;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.ConfettiSpec;
import org.certforge.model.shape.FishSpec;
import org.certforge.model.shape.MedalSpec;
import org.certforge.model.shape.StarSpec;
import org.certforge.model.shape.WaveSpec;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.panel.PrizePanelLayout;
import org.certforge.service.panel.RecordPanelLayout;
import org.certforge.service.primitive.Confetti;
import org.certforge.service.primitive.Fish;
import org.certforge.service.primitive.Medals;
import org.certforge.service.primitive.Stars;
import org.certforge.service.primitive.Waves;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.util.List;

/**
 * Underwater theme: water lines, bubble columns and fish around the record panel, confetti and a medal above the prize panel.
 */
@Component
public class AdventureRecipe extends VariantRecipe {

    static final Palette RECORD_PALETTE = Palette.builder()
            .panel(26, 124, 182)
            .accent(20, 141, 207)
            .header(204, 240, 255)
            .soft(236, 249, 255)
            .line(137, 205, 232)
            .build();

    static final Palette PRIZE_PALETTE = Palette.builder()
            .panel(26, 124, 182)
            .accent(20, 141, 207)
            .soft(236, 249, 255)
            .build();

    private static final Color SURFACE = rgba(197, 239, 255, 190);

    private static final List<FishSpec> RECORD_FISH = List.of(
            new FishSpec(230, 940, 70, rgba(255, 236, 153, 220), false),
            new FishSpec(2180, 1090, 66, rgba(255, 236, 153, 210), true),
            new FishSpec(250, 2520, 72, rgba(255, 215, 136, 210), false),
            new FishSpec(2150, 2730, 68, rgba(255, 215, 136, 205), true));

    private static final List<StarSpec> RECORD_STARS = List.of(
            new StarSpec(355, 520, 30, 12),
            new StarSpec(2080, 560, 26, 10),
            new StarSpec(430, 3030, 34, 13),
            new StarSpec(2050, 2980, 30, 12));

    private static final List<StarSpec> PRIZE_STARS = List.of(
            new StarSpec(360, 460, 30, 12),
            new StarSpec(560, 330, 24, 10),
            new StarSpec(2050, 1040, 22, 9));

    private static final ConfettiSpec PRIZE_CONFETTI = new ConfettiSpec(
            new Box(220, 210, 2260, 1180),
            90,
            List.of(rgba(255, 244, 187, 220), rgba(255, 220, 118, 220), rgba(192, 245, 255, 210), rgba(173, 224, 255, 220)),
            108);

    public AdventureRecipe(RecordPanelLayout recordLayout, PrizePanelLayout prizeLayout) {
        super(recordLayout, prizeLayout);
    }

    @Override
    public TemplateVariant getVariant() {
        return TemplateVariant.ADVENTURE;
    }

    @Override
    public Palette palette(CertificateType type) {
        return type == CertificateType.RECORD ? RECORD_PALETTE : PRIZE_PALETTE;
    }

    @Override
    protected Canvas paintRecordArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(145, 224, 255), rgb(19, 151, 223));

        Waves.drawTop(canvas, new WaveSpec(360, 34, 420, SURFACE));
        Waves.drawBottom(canvas, new WaveSpec(3340, 42, 450, rgba(3, 127, 187, 210)));
        Waves.drawBottom(canvas, new WaveSpec(3415, 36, 360, rgba(3, 103, 159, 255)));

        paintBubbleColumns(canvas);

        RECORD_FISH.forEach(fish -> Fish.draw(canvas, fish));
        Color starColor = rgba(255, 244, 183, 230);
        RECORD_STARS.forEach(star -> Stars.draw(canvas, star, starColor));
        return canvas;
    }

    @Override
    protected Canvas paintPrizeArtwork(CanvasSpec spec) {
        Canvas canvas = Canvas.gradient(spec, rgb(147, 227, 255), rgb(15, 146, 214));

        Waves.drawTop(canvas, new WaveSpec(390, 38, 420, SURFACE));
        Waves.drawBottom(canvas, new WaveSpec(3345, 46, 430, rgba(3, 127, 187, 205)));
        Waves.drawBottom(canvas, new WaveSpec(3420, 34, 320, rgba(3, 103, 159, 255)));

        Confetti.draw(canvas, PRIZE_CONFETTI);
        Medals.draw(canvas, new MedalSpec(2040, 470, 130));

        Color starColor = rgba(255, 248, 204, 235);
        PRIZE_STARS.forEach(star -> Stars.draw(canvas, star, starColor));
        return canvas;
    }

    // Rising bubbles along both margins, an extra small one on every other row at the left.
    private void paintBubbleColumns(Canvas canvas) {
        Color left = rgba(238, 252, 255, 180);
        Color right = rgba(233, 250, 255, 170);
        Color small = rgba(233, 250, 255, 150);
        int row = 0;
        for (int y = 420; y < 3270; y += 320, row++) {
            canvas.drawEllipse(new Box(90, y, 240, y + 150), left, 6);
            canvas.drawEllipse(new Box(2260, y + 80, 2380, y + 200), right, 5);
            if (row % 2 == 0) {
                canvas.drawEllipse(new Box(180, y + 200, 260, y + 280), small, 4);
            }
        }
    }
}
