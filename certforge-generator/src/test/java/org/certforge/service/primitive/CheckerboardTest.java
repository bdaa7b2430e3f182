package org.certforge.service.primitive;

import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckerboardTest {

    @Test
    void draw_tintsEvenSquaresOnly() {
        Canvas canvas = Canvas.gradient(new CanvasSpec(50, 50), Color.BLACK, Color.BLACK);

        Checkerboard.draw(canvas, 20, Color.WHITE);

        assertThat(canvas.getRgb(5, 5)).isEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRgb(25, 5)).isEqualTo(Color.BLACK.getRGB());
        assertThat(canvas.getRgb(25, 25)).isEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRgb(45, 5)).isEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRgb(45, 25)).isEqualTo(Color.BLACK.getRGB());
    }

    @Test
    void draw_rejectsNonPositiveSquare() {
        Canvas canvas = new Canvas(new CanvasSpec(10, 10));

        assertThatThrownBy(() -> Checkerboard.draw(canvas, 0, Color.WHITE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
