package org.certforge.service.panel;

import org.certforge.model.Palette;
import org.certforge.model.enums.PaletteRole;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;

import java.util.Set;

/**
 * Fixed arrangement of information boxes drawn over a certificate's artwork.
 */
public interface PanelLayout {

    String getName();

    Set<PaletteRole> requiredRoles();

    /**
     * Rectangle containing every pixel the layout can touch, drop shadow included.
     */
    Box bounds();

    /**
     * Draws the layout. Fails with {@code MISSING_PALETTE_ROLE} before touching the canvas when the palette
     * lacks any of {@link #requiredRoles()}.
     */
    void draw(Canvas canvas, Palette palette);
}
