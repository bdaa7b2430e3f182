package org.certforge.service.panel;

import org.certforge.model.Palette;
import org.certforge.model.enums.PaletteRole;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;

import java.awt.Color;
import java.util.List;

public abstract class AbstractPanelLayout implements PanelLayout {

    protected static final Color SHADOW = new Color(0, 0, 0, 38);
    protected static final Color PANEL_FILL = new Color(255, 255, 255, 245);
    protected static final int SHADOW_DX = 10;
    protected static final int SHADOW_DY = 12;
    protected static final int PANEL_RADIUS = 92;
    protected static final int PANEL_OUTLINE = 8;

    protected abstract Box panel();

    /**
     * Every box drawn on top of the panel.
     */
    protected abstract List<Box> boxes();

    protected abstract void drawBoxes(Canvas canvas, Palette palette);

    @Override
    public Box bounds() {
        Box bounds = panel().union(panel().translate(SHADOW_DX, SHADOW_DY));
        for (Box box : boxes()) {
            bounds = bounds.union(box);
        }
        return bounds;
    }

    @Override
    public final void draw(Canvas canvas, Palette palette) {
        palette.requireAll(requiredRoles(), getName() + " panel");

        canvas.fillRoundedRect(panel().translate(SHADOW_DX, SHADOW_DY), PANEL_RADIUS, SHADOW, null, 0);
        canvas.fillRoundedRect(panel(), PANEL_RADIUS, PANEL_FILL, palette.require(PaletteRole.PANEL), PANEL_OUTLINE);
        drawBoxes(canvas, palette);
    }
}
