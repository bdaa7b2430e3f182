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

/**
 * Record certificate: name and grade boxes, a two-column table under a header bar, and the issue date.
 */
@Component
public class RecordPanelLayout extends AbstractPanelLayout {

    private static final Color TABLE_FILL = new Color(255, 255, 255, 248);
    private static final Set<PaletteRole> ROLES = EnumSet.allOf(PaletteRole.class);

    private final RecordPanelGeometry geometry;

    public RecordPanelLayout() {
        this(RecordPanelGeometry.A4);
    }

    public RecordPanelLayout(RecordPanelGeometry geometry) {
        this.geometry = geometry;
    }

    @Override
    public String getName() {
        return "record";
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
        return List.of(geometry.name(), geometry.grade(), geometry.header(), geometry.table(), geometry.issue());
    }

    @Override
    protected void drawBoxes(Canvas canvas, Palette palette) {
        Color accent = palette.require(PaletteRole.ACCENT);
        Color soft = palette.require(PaletteRole.SOFT);
        Color line = palette.require(PaletteRole.LINE);
        Box header = geometry.header();
        Box table = geometry.table();

        canvas.fillRoundedRect(geometry.name(), 46, soft, accent, 6);
        canvas.fillRoundedRect(geometry.grade(), 46, soft, accent, 6);

        canvas.fillRoundedRect(header, 34, palette.require(PaletteRole.HEADER), accent, 6);
        canvas.fillRoundedRect(table, 36, TABLE_FILL, line, 5);
        canvas.fillRoundedRect(geometry.issue(), 32, soft, accent, 5);

        canvas.drawLine(geometry.splitX(), header.top(), geometry.splitX(), table.bottom(), line, 5);

        double rowStep = (double) table.height() / geometry.rows();
        for (int i = 1; i < geometry.rows(); i++) {
            int y = (int) (table.top() + rowStep * i);
            canvas.drawLine(table.left(), y, table.right(), y, line, 3);
        }
    }
}
