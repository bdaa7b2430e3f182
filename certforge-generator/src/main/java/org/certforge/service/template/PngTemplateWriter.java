package org.certforge.service.template;

import lombok.extern.slf4j.Slf4j;
import org.certforge.config.TemplateProperties;
import org.certforge.exception.TemplateError;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes opaque RGB PNG files tagged with the configured resolution in a {@code pHYs} chunk.
 * The file is written next to the target and moved into place, so a failed write never leaves a truncated image.
 */
@Slf4j
@Component
public class PngTemplateWriter implements TemplateWriter {

    private static final String PNG_METADATA_FORMAT = "javax_imageio_png_1.0";
    private static final double METERS_PER_INCH = 0.0254;

    private final int dpi;

    @Autowired
    public PngTemplateWriter(TemplateProperties properties) {
        this(properties.getDpi());
    }

    public PngTemplateWriter(int dpi) {
        this.dpi = dpi;
    }

    @Override
    public void write(BufferedImage image, Path target) {
        Path temp = null;
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");

            try (OutputStream out = Files.newOutputStream(temp)) {
                encode(toRgb(image), out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote template {} ({}x{} @ {} dpi)", target, image.getWidth(), image.getHeight(), dpi);
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("Failed to write template {}", target, e);
            throw TemplateError.TEMPLATE_WRITE_FAILED.createException(e, target, e.getMessage());
        }
    }

    static long pixelsPerMeter(int dpi) {
        return Math.round(dpi / METERS_PER_INCH);
    }

    private void encode(BufferedImage rgb, OutputStream out) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("png").next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(rgb), param);
            tagResolution(metadata);

            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, metadata), param);
        } finally {
            writer.dispose();
        }
    }

    private void tagResolution(IIOMetadata metadata) throws IIOInvalidTreeException {
        String ppm = Long.toString(pixelsPerMeter(dpi));
        IIOMetadataNode phys = new IIOMetadataNode("pHYs");
        phys.setAttribute("pixelsPerUnitXAxis", ppm);
        phys.setAttribute("pixelsPerUnitYAxis", ppm);
        phys.setAttribute("unitSpecifier", "meter");

        IIOMetadataNode root = new IIOMetadataNode(PNG_METADATA_FORMAT);
        root.appendChild(phys);
        metadata.mergeTree(PNG_METADATA_FORMAT, root);
    }

    // Drops the alpha channel without compositing, the canvas is opaque after its background fill.
    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            rgb.setRGB(0, y, w, 1, row, 0, w);
        }
        return rgb;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
