package org.certforge.service.panel;

import org.certforge.model.shape.Box;

public record PrizePanelGeometry(Box panel, Box name, Box meta, Box event, Box time, Box issue) {

    public static final PrizePanelGeometry A4 = new PrizePanelGeometry(
            new Box(250, 620, 2230, 3230),
            new Box(430, 1220, 2050, 1710),
            new Box(560, 1850, 1920, 2015),
            new Box(420, 2140, 2060, 2360),
            new Box(520, 2430, 1960, 2630),
            new Box(860, 2880, 1620, 3060));
}
