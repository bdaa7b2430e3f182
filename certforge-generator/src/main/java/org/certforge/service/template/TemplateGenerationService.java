package org.certforge.service.template;

import lombok.extern.slf4j.Slf4j;
import org.certforge.config.TemplateProperties;
import org.certforge.exception.TemplateError;
import org.certforge.exception.TemplateException;
import org.certforge.model.dto.GenerationReport;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.service.canvas.CanvasSpec;
import org.certforge.service.variant.VariantRecipe;
import org.certforge.service.variant.VariantRecipeRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class TemplateGenerationService {

    private final VariantRecipeRegistry recipeRegistry;
    private final TemplateWriter templateWriter;
    private final TemplatePaths templatePaths;
    private final TemplateActivationService activationService;
    private final TemplateProperties properties;
    private final Executor renderExecutor;

    public TemplateGenerationService(VariantRecipeRegistry recipeRegistry, TemplateWriter templateWriter,
                                     TemplatePaths templatePaths, TemplateActivationService activationService,
                                     TemplateProperties properties, @Qualifier("renderExecutor") Executor renderExecutor) {
        this.recipeRegistry = recipeRegistry;
        this.templateWriter = templateWriter;
        this.templatePaths = templatePaths;
        this.activationService = activationService;
        this.properties = properties;
        this.renderExecutor = renderExecutor;
    }

    public List<Path> renderVariant(String variantName) {
        return renderVariant(TemplateVariant.fromName(variantName));
    }

    /**
     * Renders both certificates of a variant in memory and only then writes them, so a failing composition
     * leaves no files behind.
     */
    public List<Path> renderVariant(TemplateVariant variant) {
        VariantRecipe recipe = recipeRegistry.get(variant);
        CanvasSpec spec = properties.canvasSpec();
        long start = System.currentTimeMillis();

        Map<CertificateType, BufferedImage> images = new EnumMap<>(CertificateType.class);
        for (CertificateType type : CertificateType.values()) {
            images.put(type, recipe.render(type, spec).finish());
        }

        List<Path> written = new ArrayList<>();
        images.forEach((type, image) -> {
            Path target = templatePaths.variantFile(variant, type);
            templateWriter.write(image, target);
            written.add(target);
        });

        log.info("Rendered variant {} in {} ms", variant.getVariantName(), System.currentTimeMillis() - start);
        return written;
    }

    /**
     * Renders every variant in parallel, then publishes the configured active variant. The active variant name is
     * validated before any rendering starts.
     */
    public GenerationReport generateAll() {
        TemplateVariant active = TemplateVariant.fromName(properties.getActiveVariant());
        long start = System.currentTimeMillis();
        log.info("Generating template variants {} (active: {})", TemplateVariant.names(), active.getVariantName());

        Map<TemplateVariant, CompletableFuture<List<Path>>> renders = new LinkedHashMap<>();
        for (TemplateVariant variant : TemplateVariant.values()) {
            renders.put(variant, CompletableFuture.supplyAsync(() -> renderVariant(variant), renderExecutor));
        }

        List<Path> rendered = new ArrayList<>();
        TemplateException failure = null;
        for (Map.Entry<TemplateVariant, CompletableFuture<List<Path>>> entry : renders.entrySet()) {
            try {
                rendered.addAll(entry.getValue().join());
            } catch (CompletionException e) {
                log.error("Rendering of variant {} failed", entry.getKey().getVariantName(), e.getCause());
                if (failure == null) {
                    failure = asTemplateException(entry.getKey(), e.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }

        List<Path> published = activationService.activate(active);
        long duration = System.currentTimeMillis() - start;
        log.info("Generated variants: {}. Active variant: {}. Duration: {} ms",
                String.join(", ", TemplateVariant.names()), active.getVariantName(), duration);

        return GenerationReport.builder()
                .variants(TemplateVariant.names())
                .activeVariant(active.getVariantName())
                .renderedFiles(rendered)
                .publishedFiles(published)
                .durationMs(duration)
                .build();
    }

    private static TemplateException asTemplateException(TemplateVariant variant, Throwable cause) {
        if (cause instanceof TemplateException templateException) {
            return templateException;
        }
        return TemplateError.RENDER_FAILED.createException(cause, variant.getVariantName(), cause.getMessage());
    }
}
