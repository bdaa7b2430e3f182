package org.certforge.service.panel;

import org.certforge.model.Palette;
import org.certforge.model.enums.PaletteRole;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class PrizePanelLayout extends AbstractPanelLayout {

    private static final Color NAME_FILL = new Color(255, 255, 255, 252);
    private static final Set<PaletteRole> ROLES = EnumSet.of(PaletteRole.PANEL, PaletteRole.ACCENT, PaletteRole.SOFT);

    private final PrizePanelGeometry geometry;

    public PrizePanelLayout() {
        this(PrizePanelGeometry.A4);
    }

    public PrizePanelLayout(PrizePanelGeometry geometry) {
        this.geometry = geometry;
    }

    @Override
    public String getName() {
        return "prize";
    }

    @Override
    public Set<PaletteRole> requiredRoles() {
        return ROLES;
    }

    @Override
    protected Box panel() {
        return geometry.panel();
    }

    @Override
    protected List<Box> boxes() {
        return List.of(geometry.name(), geometry.meta(), geometry.event(), geometry.time(), geometry.issue());
    }

    @Override
    protected void drawBoxes(Canvas canvas, Palette palette) {
        Color accent = palette.require(PaletteRole.ACCENT);
        Color soft = palette.require(PaletteRole.SOFT);

        canvas.fillRoundedRect(geometry.name(), 58, NAME_FILL, accent, 7);
        canvas.fillRoundedRect(geometry.meta(), 30, soft, accent, 5);
        canvas.fillRoundedRect(geometry.event(), 34, soft, accent, 6);
        canvas.fillRoundedRect(geometry.time(), 34, soft, accent, 6);
        canvas.fillRoundedRect(geometry.issue(), 30, soft, accent, 5);
    }
}
