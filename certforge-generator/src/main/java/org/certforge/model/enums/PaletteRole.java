package org.certforge.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum PaletteRole {
    PANEL("panel"),
    ACCENT("accent"),
    SOFT("soft"),
    HEADER("header"),
    LINE("line");

    private final String roleName;
}
