package org.certforge.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.certforge.exception.TemplateError;
import org.certforge.model.enums.PaletteRole;

import java.awt.Color;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable mapping from {@link PaletteRole} to colour, handed to panel layouts.
 * Lookups of a role that is not present fail instead of falling back to a default.
 */
@EqualsAndHashCode
@ToString
public final class Palette {

    private final Map<PaletteRole, Color> colors;

    private Palette(Map<PaletteRole, Color> colors) {
        this.colors = Collections.unmodifiableMap(colors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Color require(PaletteRole role) {
        Color color = colors.get(role);
        if (color == null) {
            throw TemplateError.MISSING_PALETTE_ROLE.createException(role.getRoleName(), this);
        }
        return color;
    }

    /**
     * Checks every role up front; the error names {@code usage} so the failing layout can be identified.
     */
    public void requireAll(Collection<PaletteRole> roles, String usage) {
        for (PaletteRole role : roles) {
            if (!colors.containsKey(role)) {
                throw TemplateError.MISSING_PALETTE_ROLE.createException(role.getRoleName(), usage);
            }
        }
    }

    public boolean has(PaletteRole role) {
        return colors.containsKey(role);
    }

    public static final class Builder {
        private final EnumMap<PaletteRole, Color> colors = new EnumMap<>(PaletteRole.class);

        private Builder() {
        }

        public Builder role(PaletteRole role, Color color) {
            colors.put(role, color);
            return this;
        }

        public Builder panel(int r, int g, int b) {
            return role(PaletteRole.PANEL, new Color(r, g, b));
        }

        public Builder accent(int r, int g, int b) {
            return role(PaletteRole.ACCENT, new Color(r, g, b));
        }

        public Builder soft(int r, int g, int b) {
            return role(PaletteRole.SOFT, new Color(r, g, b));
        }

        public Builder header(int r, int g, int b) {
            return role(PaletteRole.HEADER, new Color(r, g, b));
        }

        public Builder line(int r, int g, int b) {
            return role(PaletteRole.LINE, new Color(r, g, b));
        }

        public Palette build() {
            return new Palette(new EnumMap<>(colors));
        }
    }
}
