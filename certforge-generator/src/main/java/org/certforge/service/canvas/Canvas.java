package org.certforge.service.canvas;

import org.certforge.model.shape.Box;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.List;

/**
 * Fixed-size ARGB raster plus the drawing surface bound to it. Every draw is composited source-over.
 * Outlines are stroked inside the outlined shape's bounds. Coordinates outside the raster clip silently.
 * <p>
 * A canvas belongs to the render that created it until {@link #finish()} hands the image off; after that
 * any further drawing fails.
 */
public final class Canvas {

    private final CanvasSpec spec;
    private final BufferedImage image;
    private Graphics2D graphics;

    public Canvas(CanvasSpec spec) {
        this.spec = spec;
        this.image = new BufferedImage(spec.width(), spec.height(), BufferedImage.TYPE_INT_ARGB);
        this.graphics = image.createGraphics();
        configureGraphics(graphics);
    }

    /**
     * Creates a canvas whose row {@code y} is filled with {@code blend(top, bottom, y / (height - 1))} at full opacity.
     */
    public static Canvas gradient(CanvasSpec spec, Color top, Color bottom) {
        Canvas canvas = new Canvas(spec);
        int height = spec.height();
        double span = Math.max(height - 1, 1);
        for (int y = 0; y < height; y++) {
            canvas.fillRect(new Box(0, y, spec.width(), y + 1), ColorBlender.blend(top, bottom, y / span));
        }
        return canvas;
    }

    private static void configureGraphics(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
    }

    public int width() {
        return spec.width();
    }

    public int height() {
        return spec.height();
    }

    public void fillRect(Box box, Color fill) {
        fill(new Rectangle2D.Double(box.left(), box.top(), box.width(), box.height()), fill);
    }

    public void fillPolygon(List<? extends Point2D> points, Color fill) {
        fill(polygon(points), fill);
    }

    public void fillPolygon(List<? extends Point2D> points, Color fill, Color outline) {
        Path2D path = polygon(points);
        fill(path, fill);
        stroke(path, outline, 1);
    }

    public void fillEllipse(Box box, Color fill) {
        fill(new Ellipse2D.Double(box.left(), box.top(), box.width(), box.height()), fill);
    }

    /**
     * Ellipse inscribed in a box with fractional edges.
     */
    public void fillEllipse(double left, double top, double right, double bottom, Color fill) {
        fill(new Ellipse2D.Double(left, top, right - left, bottom - top), fill);
    }

    public void fillEllipse(Box box, Color fill, Color outline, int outlineWidth) {
        fillEllipse(box, fill);
        drawEllipse(box, outline, outlineWidth);
    }

    public void drawEllipse(Box box, Color outline, int outlineWidth) {
        double half = outlineWidth / 2.0;
        stroke(new Ellipse2D.Double(box.left() + half, box.top() + half,
                box.width() - outlineWidth, box.height() - outlineWidth), outline, outlineWidth);
    }

    public void fillRoundedRect(Box box, int radius, Color fill, Color outline, int outlineWidth) {
        double arc = radius * 2.0;
        fill(new RoundRectangle2D.Double(box.left(), box.top(), box.width(), box.height(), arc, arc), fill);
        if (outline != null && outlineWidth > 0) {
            double half = outlineWidth / 2.0;
            double innerArc = Math.max(arc - outlineWidth, 0);
            stroke(new RoundRectangle2D.Double(box.left() + half, box.top() + half,
                    box.width() - outlineWidth, box.height() - outlineWidth, innerArc, innerArc), outline, outlineWidth);
        }
    }

    public void drawLine(double x1, double y1, double x2, double y2, Color color, int width) {
        stroke(new Line2D.Double(x1, y1, x2, y2), color, width);
    }

    public int getRgb(int x, int y) {
        return image.getRGB(x, y);
    }

    /**
     * Copy of the raw ARGB pixels, row-major.
     */
    public int[] pixels() {
        return ((DataBufferInt) image.getRaster().getDataBuffer()).getData().clone();
    }

    public boolean isFinished() {
        return graphics == null;
    }

    /**
     * Releases the drawing surface and returns the finished image. The canvas accepts no draws afterwards.
     */
    public BufferedImage finish() {
        if (graphics != null) {
            graphics.dispose();
            graphics = null;
        }
        return image;
    }

    private void fill(Shape shape, Color color) {
        Graphics2D g = surface();
        g.setColor(color);
        g.fill(shape);
    }

    private void stroke(Shape shape, Color color, int width) {
        Graphics2D g = surface();
        g.setColor(color);
        g.setStroke(new BasicStroke(width, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
        g.draw(shape);
    }

    private Graphics2D surface() {
        if (graphics == null) {
            throw new IllegalStateException("Canvas has already been finished");
        }
        return graphics;
    }

    private static Path2D polygon(List<? extends Point2D> points) {
        Path2D.Double path = new Path2D.Double();
        for (int i = 0; i < points.size(); i++) {
            Point2D p = points.get(i);
            if (i == 0) {
                path.moveTo(p.getX(), p.getY());
            } else {
                path.lineTo(p.getX(), p.getY());
            }
        }
        path.closePath();
        return path;
    }
}
