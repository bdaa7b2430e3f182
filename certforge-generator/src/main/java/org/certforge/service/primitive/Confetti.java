package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.Box;
import org.certforge.model.shape.ConfettiPiece;
import org.certforge.model.shape.ConfettiSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@UtilityClass
public class Confetti {

    public final int MIN_WIDTH = 16;
    public final int MAX_WIDTH = 42;
    public final int MIN_HEIGHT = 8;
    public final int MAX_HEIGHT = 28;

    public void draw(Canvas canvas, ConfettiSpec confetti) {
        for (ConfettiPiece piece : scatter(confetti)) {
            if (piece.rectangle()) {
                canvas.fillRect(piece.extent(), piece.color());
            } else {
                canvas.fillEllipse(piece.extent(), piece.color());
            }
        }
    }

    /**
     * Places the pieces with a generator seeded for this call only, so the result depends on nothing but the spec.
     * Anchors are uniform over the bounds with both edges included; each piece extends right and down from its anchor.
     */
    public List<ConfettiPiece> scatter(ConfettiSpec confetti) {
        Random random = new Random(confetti.seed());
        Box bounds = confetti.bounds();
        List<Color> palette = confetti.palette();
        List<ConfettiPiece> pieces = new ArrayList<>(confetti.count());
        for (int i = 0; i < confetti.count(); i++) {
            int x = between(random, bounds.left(), bounds.right());
            int y = between(random, bounds.top(), bounds.bottom());
            int w = between(random, MIN_WIDTH, MAX_WIDTH);
            int h = between(random, MIN_HEIGHT, MAX_HEIGHT);
            Color color = palette.get(random.nextInt(palette.size()));
            boolean rectangle = random.nextDouble() > 0.5;
            pieces.add(new ConfettiPiece(x, y, w, h, color, rectangle));
        }
        return pieces;
    }

    private int between(Random random, int lowInclusive, int highInclusive) {
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }
}
