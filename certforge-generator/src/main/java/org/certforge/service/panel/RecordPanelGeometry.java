package org.certforge.service.panel;

import org.certforge.model.shape.Box;

/**
 * Box positions of the record certificate. The header and table share a column split at {@code splitX};
 * the table body is cut into {@code rows} equal rows.
 */
public record RecordPanelGeometry(Box panel, Box name, Box grade, Box header, Box table, Box issue,
                                  int splitX, int rows) {

    public static final RecordPanelGeometry A4 = new RecordPanelGeometry(
            new Box(250, 680, 2230, 3230),
            new Box(440, 850, 1655, 1200),
            new Box(1680, 850, 2180, 1200),
            new Box(600, 1330, 2260, 1450),
            new Box(600, 1450, 2260, 2370),
            new Box(820, 2860, 1660, 3050),
            1510,
            7);
}
