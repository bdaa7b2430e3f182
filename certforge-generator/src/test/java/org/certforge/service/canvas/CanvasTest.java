package org.certforge.service.canvas;

import org.certforge.model.shape.Box;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanvasTest {

    private static final CanvasSpec SMALL = new CanvasSpec(40, 101);

    @Test
    void gradient_fillsEveryRowWithBlendedColorAtFullOpacity() {
        Color top = new Color(255, 244, 190);
        Color bottom = new Color(255, 195, 144);

        Canvas canvas = Canvas.gradient(SMALL, top, bottom);

        for (int y = 0; y < SMALL.height(); y++) {
            Color expected = ColorBlender.blend(top, bottom, y / 100.0);
            for (int x = 0; x < SMALL.width(); x++) {
                assertThat(canvas.getRgb(x, y)).isEqualTo(expected.getRGB());
            }
        }
    }

    @Test
    void gradient_firstAndLastRowsMatchEndpoints() {
        Color top = new Color(155, 246, 228);
        Color bottom = new Color(67, 175, 255);

        Canvas canvas = Canvas.gradient(SMALL, top, bottom);

        assertThat(canvas.getRgb(0, 0)).isEqualTo(top.getRGB());
        assertThat(canvas.getRgb(0, SMALL.height() - 1)).isEqualTo(bottom.getRGB());
    }

    @Test
    void gradient_singleRowCanvas_usesTopColor() {
        Canvas canvas = Canvas.gradient(new CanvasSpec(3, 1), Color.RED, Color.BLUE);

        assertThat(canvas.getRgb(1, 0)).isEqualTo(Color.RED.getRGB());
    }

    @Test
    void gradient_a4Canvas_hasFixedDimensions() {
        Canvas canvas = Canvas.gradient(CanvasSpec.A4_300_DPI, Color.WHITE, Color.BLACK);
        BufferedImage image = canvas.finish();

        assertThat(image.getWidth()).isEqualTo(2480);
        assertThat(image.getHeight()).isEqualTo(3508);
    }

    @Test
    void fillRect_translucentColor_compositesOverBackground() {
        Canvas canvas = Canvas.gradient(SMALL, Color.WHITE, Color.WHITE);

        canvas.fillRect(new Box(0, 0, 10, 10), new Color(0, 0, 0, 128));

        Color blended = new Color(canvas.getRgb(5, 5), true);
        assertThat(blended.getAlpha()).isEqualTo(255);
        assertThat(blended.getRed()).isBetween(125, 129);
        assertThat(canvas.getRgb(20, 20)).isEqualTo(Color.WHITE.getRGB());
    }

    @Test
    void fillRoundedRect_outlineStaysInsideBox() {
        Canvas canvas = Canvas.gradient(SMALL, Color.WHITE, Color.WHITE);

        canvas.fillRoundedRect(new Box(10, 10, 30, 90), 4, Color.WHITE, Color.RED, 4);

        assertThat(canvas.getRgb(11, 50)).isEqualTo(Color.RED.getRGB());
        assertThat(canvas.getRgb(9, 50)).isEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRgb(30, 50)).isEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRgb(20, 50)).isEqualTo(Color.WHITE.getRGB());
    }

    @Test
    void drawing_outsideCanvas_clipsSilently() {
        Canvas canvas = Canvas.gradient(SMALL, Color.WHITE, Color.WHITE);
        int[] before = canvas.pixels();

        canvas.fillEllipse(new Box(-500, -500, -100, -100), Color.BLACK);
        canvas.drawLine(1000, 1000, 2000, 2000, Color.BLACK, 5);

        assertThat(canvas.pixels()).isEqualTo(before);
    }

    @Test
    void finish_preventsFurtherDrawing() {
        Canvas canvas = new Canvas(SMALL);
        canvas.finish();

        assertThat(canvas.isFinished()).isTrue();
        assertThatThrownBy(() -> canvas.fillRect(new Box(0, 0, 1, 1), Color.BLACK))
                .isInstanceOf(IllegalStateException.class);
    }
}
