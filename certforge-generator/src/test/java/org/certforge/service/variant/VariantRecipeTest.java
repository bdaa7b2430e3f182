package org.certforge.service.variant;

import org.certforge.exception.TemplateException;
import org.certforge.model.Palette;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.PaletteRole;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.panel.PrizePanelLayout;
import org.certforge.service.panel.RecordPanelLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariantRecipeTest {

    private static final CanvasSpec A4 = CanvasSpec.A4_300_DPI;
    private final Map<TemplateVariant, VariantRecipe> recipes = RecipeFixtures.recipes();

    @ParameterizedTest
    @EnumSource(TemplateVariant.class)
    void render_isDeterministic(TemplateVariant variant) {
        VariantRecipe recipe = recipes.get(variant);
        for (CertificateType type : CertificateType.values()) {
            int[] first = recipe.render(type, A4).pixels();
            int[] second = recipe.render(type, A4).pixels();

            assertTrue(Arrays.equals(first, second), variant + " " + type + " differs between renders");
        }
    }

    @ParameterizedTest
    @EnumSource(TemplateVariant.class)
    void render_hasFixedSizeAndIsOpaqueEverywhere(TemplateVariant variant) {
        VariantRecipe recipe = recipes.get(variant);
        for (CertificateType type : CertificateType.values()) {
            BufferedImage image = recipe.render(type, A4).finish();

            assertThat(image.getWidth()).isEqualTo(2480);
            assertThat(image.getHeight()).isEqualTo(3508);
            int[] argb = image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
            assertTrue(Arrays.stream(argb).allMatch(p -> (p >>> 24) == 0xFF), variant + " " + type + " has translucent pixels");
        }
    }

    @ParameterizedTest
    @EnumSource(TemplateVariant.class)
    void render_panelChangesPixelsOnlyWithinItsBounds(TemplateVariant variant) {
        VariantRecipe recipe = recipes.get(variant);
        for (CertificateType type : CertificateType.values()) {
            int[] backdrop = recipe.renderBackdrop(type, A4).pixels();
            int[] full = recipe.render(type, A4).pixels();
            Box bounds = recipe.layout(type).bounds();

            int changed = 0;
            for (int i = 0; i < full.length; i++) {
                if (full[i] != backdrop[i]) {
                    changed++;
                    int x = i % A4.width();
                    int y = i / A4.width();
                    assertTrue(bounds.contains(x, y), variant + " " + type + " changed pixel outside panel at " + x + "," + y);
                }
            }
            assertThat(changed).isPositive();
        }
    }

    @ParameterizedTest
    @EnumSource(TemplateVariant.class)
    void palettes_coverTheirLayoutRoles(TemplateVariant variant) {
        VariantRecipe recipe = recipes.get(variant);
        for (CertificateType type : CertificateType.values()) {
            Palette palette = recipe.palette(type);
            recipe.layout(type).requiredRoles().forEach(role -> assertThat(palette.has(role)).isTrue());
        }
    }

    @Test
    void adventure_panelsUseAdventurePalette() {
        VariantRecipe adventure = recipes.get(TemplateVariant.ADVENTURE);
        Color panel = new Color(26, 124, 182);
        Color accent = new Color(20, 141, 207);

        assertThat(adventure.palette(CertificateType.RECORD).require(PaletteRole.PANEL)).isEqualTo(panel);
        assertThat(adventure.palette(CertificateType.RECORD).require(PaletteRole.ACCENT)).isEqualTo(accent);
        assertThat(adventure.palette(CertificateType.RECORD).require(PaletteRole.HEADER)).isEqualTo(new Color(204, 240, 255));
        assertThat(adventure.palette(CertificateType.RECORD).require(PaletteRole.SOFT)).isEqualTo(new Color(236, 249, 255));
        assertThat(adventure.palette(CertificateType.RECORD).require(PaletteRole.LINE)).isEqualTo(new Color(137, 205, 232));
        assertThat(adventure.palette(CertificateType.FIRST_PRIZE).require(PaletteRole.PANEL)).isEqualTo(panel);

        Canvas record = adventure.render(CertificateType.RECORD, A4);
        assertThat(record.getRgb(254, 1900)).isEqualTo(panel.getRGB());
        assertThat(record.getRgb(442, 1000)).isEqualTo(accent.getRGB());

        Canvas prize = adventure.render(CertificateType.FIRST_PRIZE, A4);
        assertThat(prize.getRgb(254, 1900)).isEqualTo(panel.getRGB());
        assertThat(prize.getRgb(433, 1450)).isEqualTo(accent.getRGB());
    }

    @Test
    void render_incompletePalette_failsBeforeDrawing() {
        VariantRecipe broken = new AdventureRecipe(new RecordPanelLayout(), new PrizePanelLayout()) {
            @Override
            public Palette palette(CertificateType type) {
                return Palette.builder().panel(1, 2, 3).build();
            }

            @Override
            protected Canvas paintRecordArtwork(CanvasSpec spec) {
                throw new AssertionError("artwork must not be painted for an incomplete palette");
            }
        };

        assertThatThrownBy(() -> broken.render(CertificateType.RECORD, A4))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("'accent'")
                .hasMessageContaining("adventure record panel");
    }

    @Test
    void variants_produceDistinctArtwork() {
        int[] adventure = recipes.get(TemplateVariant.ADVENTURE).renderBackdrop(CertificateType.RECORD, A4).pixels();
        int[] medal = recipes.get(TemplateVariant.MEDAL_FES).renderBackdrop(CertificateType.RECORD, A4).pixels();

        assertThat(Arrays.equals(adventure, medal)).isFalse();
    }
}
