package org.certforge.service.template;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Persists a finished image. Implementations create missing parent directories and report failures as
 * {@code TEMPLATE_WRITE_FAILED}; the image passed in is never modified.
 */
public interface TemplateWriter {

    void write(BufferedImage image, Path target);
}
