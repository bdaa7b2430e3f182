package org.certforge.service.primitive;

import lombok.experimental.UtilityClass;
import org.certforge.model.shape.WaveSpec;
import org.certforge.service.canvas.Canvas;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class Waves {

    public final int SAMPLE_STEP = 28;

    /**
     * Band between the top edge of the canvas and the wave.
     */
    public void drawTop(Canvas canvas, WaveSpec wave) {
        canvas.fillPolygon(band(canvas.width(), 0, wave), wave.fill());
    }

    /**
     * Band between the wave and the bottom edge of the canvas.
     */
    public void drawBottom(Canvas canvas, WaveSpec wave) {
        canvas.fillPolygon(band(canvas.width(), canvas.height(), wave), wave.fill());
    }

    public List<Point2D.Double> band(int width, int anchorY, WaveSpec wave) {
        List<Point2D.Double> points = new ArrayList<>();
        points.add(new Point2D.Double(0, anchorY));
        points.addAll(edge(width, wave));
        points.add(new Point2D.Double(width, anchorY));
        return points;
    }

    /**
     * Samples the wave every {@link #SAMPLE_STEP} pixels from {@code x = 0} through the first sample past the right edge.
     */
    public List<Point2D.Double> edge(int width, WaveSpec wave) {
        List<Point2D.Double> points = new ArrayList<>();
        for (int x = 0; x < width + SAMPLE_STEP; x += SAMPLE_STEP) {
            double y = wave.baseline() + Math.sin((double) x / wave.wavelength() * 2 * Math.PI) * wave.amplitude();
            points.add(new Point2D.Double(x, y));
        }
        return points;
    }
}
