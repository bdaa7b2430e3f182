package org.certforge.service.template;

import org.certforge.config.TemplateProperties;
import org.certforge.exception.TemplateError;
import org.certforge.exception.TemplateException;
import org.certforge.model.dto.GenerationReport;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.model.shape.Box;
import org.certforge.service.canvas.Canvas;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.variant.VariantRecipe;
import org.certforge.service.variant.VariantRecipeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemplateGenerationServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private VariantRecipeRegistry recipeRegistry;

    @Mock
    private VariantRecipe recipe;

    @Mock
    private TemplateWriter templateWriter;

    @Mock
    private TemplateActivationService activationService;

    private TemplateProperties properties;
    private TemplatePaths templatePaths;
    private TemplateGenerationService generationService;

    @BeforeEach
    void setUp() {
        properties = new TemplateProperties();
        properties.getCanvas().setWidth(4);
        properties.getCanvas().setHeight(4);
        templatePaths = new TemplatePaths(tempDir);
        generationService = new TemplateGenerationService(recipeRegistry, templateWriter, templatePaths,
                activationService, properties, Runnable::run);
    }

    private static Canvas smallCanvas() {
        Canvas canvas = new Canvas(new CanvasSpec(4, 4));
        canvas.fillRect(new Box(0, 0, 3, 3), Color.WHITE);
        return canvas;
    }

    @Test
    void renderVariant_unknownName_writesNothing() {
        assertThatThrownBy(() -> generationService.renderVariant("space-fest"))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("space-fest")
                .satisfies(e -> assertThat(((TemplateException) e).getError()).isEqualTo(TemplateError.UNKNOWN_VARIANT));

        verifyNoInteractions(recipeRegistry, templateWriter, activationService);
    }

    @Test
    void renderVariant_writesBothCertificatesIntoVariantDirectory() {
        when(recipeRegistry.get(TemplateVariant.SWIM_HERO)).thenReturn(recipe);
        when(recipe.render(any(CertificateType.class), eq(new CanvasSpec(4, 4))))
                .thenAnswer(invocation -> smallCanvas());

        List<Path> written = generationService.renderVariant("swim-hero");

        assertThat(written).containsExactly(
                templatePaths.variantFile(TemplateVariant.SWIM_HERO, CertificateType.RECORD),
                templatePaths.variantFile(TemplateVariant.SWIM_HERO, CertificateType.FIRST_PRIZE));
        verify(templateWriter).write(any(BufferedImage.class), eq(written.get(0)));
        verify(templateWriter).write(any(BufferedImage.class), eq(written.get(1)));
        verifyNoInteractions(activationService);
    }

    @Test
    void renderVariant_secondCompositionFails_writesNothing() {
        when(recipeRegistry.get(TemplateVariant.ADVENTURE)).thenReturn(recipe);
        when(recipe.render(eq(CertificateType.RECORD), any(CanvasSpec.class))).thenAnswer(invocation -> smallCanvas());
        when(recipe.render(eq(CertificateType.FIRST_PRIZE), any(CanvasSpec.class)))
                .thenThrow(TemplateError.MISSING_PALETTE_ROLE.createException("soft", "prize-panel"));

        assertThatThrownBy(() -> generationService.renderVariant(TemplateVariant.ADVENTURE))
                .isInstanceOf(TemplateException.class);

        verifyNoInteractions(templateWriter);
    }

    @Test
    void generateAll_rendersEveryVariantThenActivates() {
        List<Path> published = List.of(templatePaths.publishedFile(CertificateType.RECORD),
                templatePaths.publishedFile(CertificateType.FIRST_PRIZE));
        when(recipeRegistry.get(any(TemplateVariant.class))).thenReturn(recipe);
        when(recipe.render(any(CertificateType.class), any(CanvasSpec.class))).thenAnswer(invocation -> smallCanvas());
        when(activationService.activate(TemplateVariant.ADVENTURE)).thenReturn(published);

        GenerationReport report = generationService.generateAll();

        InOrder order = inOrder(templateWriter, activationService);
        order.verify(templateWriter, times(6)).write(any(BufferedImage.class), any(Path.class));
        order.verify(activationService).activate(TemplateVariant.ADVENTURE);

        assertThat(report.getVariants()).containsExactly("adventure", "medal-fes", "swim-hero");
        assertThat(report.getActiveVariant()).isEqualTo("adventure");
        assertThat(report.getRenderedFiles()).hasSize(6);
        assertThat(report.getPublishedFiles()).isEqualTo(published);
    }

    @Test
    void generateAll_invalidActiveVariant_rendersNothing() {
        properties.setActiveVariant("space-fest");

        assertThatThrownBy(() -> generationService.generateAll())
                .isInstanceOf(TemplateException.class)
                .satisfies(e -> assertThat(((TemplateException) e).getError()).isEqualTo(TemplateError.UNKNOWN_VARIANT));

        verifyNoInteractions(recipeRegistry, templateWriter, activationService);
    }

    @Test
    void generateAll_renderFailure_skipsActivation() {
        when(recipeRegistry.get(any(TemplateVariant.class))).thenReturn(recipe);
        when(recipe.render(any(CertificateType.class), any(CanvasSpec.class)))
                .thenThrow(TemplateError.MISSING_PALETTE_ROLE.createException("accent", "record-panel"));

        assertThatThrownBy(() -> generationService.generateAll())
                .isInstanceOf(TemplateException.class)
                .satisfies(e -> assertThat(((TemplateException) e).getError()).isEqualTo(TemplateError.MISSING_PALETTE_ROLE));

        verify(activationService, never()).activate(any(TemplateVariant.class));
        verifyNoInteractions(templateWriter);
    }

    @Test
    void generateAll_unexpectedFailure_isWrappedAsRenderFailed() {
        when(recipeRegistry.get(any(TemplateVariant.class))).thenReturn(recipe);
        when(recipe.render(any(CertificateType.class), any(CanvasSpec.class)))
                .thenThrow(new IllegalStateException("canvas already finished"));

        assertThatThrownBy(() -> generationService.generateAll())
                .isInstanceOf(TemplateException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((TemplateException) e).getError()).isEqualTo(TemplateError.RENDER_FAILED));

        verify(activationService, never()).activate(any(TemplateVariant.class));
    }
}
