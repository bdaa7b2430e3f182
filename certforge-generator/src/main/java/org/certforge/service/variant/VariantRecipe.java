package org.certforge.service.variant;

import org.certforge.model.Palette;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.panel.PanelLayout;
import org.certforge.service.panel.PrizePanelLayout;
import org.certforge.service.panel.RecordPanelLayout;

import java.awt.Color;

/**
 * One visual theme, able to compose a record and a first-prize certificate.
 * <p>
 * Every composition runs gradient, background art, foreground art and finally the panel layout, so the panel
 * always sits on top. The literal coordinates are laid out for {@link CanvasSpec#A4_300_DPI}.
 * Recipes hold no mutable state and may render several images concurrently.
 */
public abstract class VariantRecipe {

    private final RecordPanelLayout recordLayout;
    private final PrizePanelLayout prizeLayout;

    protected VariantRecipe(RecordPanelLayout recordLayout, PrizePanelLayout prizeLayout) {
        this.recordLayout = recordLayout;
        this.prizeLayout = prizeLayout;
    }

    public abstract TemplateVariant getVariant();

    public abstract Palette palette(CertificateType type);

    protected abstract Canvas paintRecordArtwork(CanvasSpec spec);

    protected abstract Canvas paintPrizeArtwork(CanvasSpec spec);

    public PanelLayout layout(CertificateType type) {
        return type == CertificateType.RECORD ? recordLayout : prizeLayout;
    }

    /**
     * Full composition. The palette is checked against the layout before anything is drawn.
     */
    public Canvas render(CertificateType type, CanvasSpec spec) {
        PanelLayout layout = layout(type);
        Palette palette = palette(type);
        palette.requireAll(layout.requiredRoles(), getVariant().getVariantName() + " " + layout.getName() + " panel");

        Canvas canvas = renderBackdrop(type, spec);
        layout.draw(canvas, palette);
        return canvas;
    }

    /**
     * The composition up to, but not including, the panel layout.
     */
    public Canvas renderBackdrop(CertificateType type, CanvasSpec spec) {
        return type == CertificateType.RECORD ? paintRecordArtwork(spec) : paintPrizeArtwork(spec);
    }

    protected static Color rgb(int r, int g, int b) {
        return new Color(r, g, b);
    }

    protected static Color rgba(int r, int g, int b, int a) {
        return new Color(r, g, b, a);
    }
}
