package org.certforge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.certforge.service.canvas.CanvasSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "certforge")
@Validated
@Getter
@Setter
public class TemplateProperties {

    /**
     * Root of the published templates. Rendered variants live in {@code variants/<name>} below it,
     * the active variant's images are copied directly into it.
     */
    @NotBlank
    private String templateDir = "public/pdf-templates";

    /**
     * Name of the variant whose images are published after a generation pass.
     * Checked against the known variants when the pass starts, not at binding time.
     */
    @NotBlank
    private String activeVariant = "adventure";

    @Min(1)
    private int dpi = 300;

    @Min(1)
    private int renderThreads = 3;

    @Valid
    private Canvas canvas = new Canvas();

    private Runner runner = new Runner();

    public Path templateRoot() {
        return Path.of(templateDir).toAbsolutePath().normalize();
    }

    public CanvasSpec canvasSpec() {
        return new CanvasSpec(canvas.getWidth(), canvas.getHeight());
    }

    @Getter
    @Setter
    public static class Canvas {
        @Min(1)
        private int width = CanvasSpec.A4_300_DPI.width();
        @Min(1)
        private int height = CanvasSpec.A4_300_DPI.height();
    }

    @Getter
    @Setter
    public static class Runner {
        private boolean enabled = true;
    }
}
