package org.certforge.service.template;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.certforge.exception.TemplateError;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes an already rendered variant by copying its two images to the template root.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateActivationService {

    private final TemplatePaths templatePaths;

    public List<Path> activate(String variantName) {
        return activate(TemplateVariant.fromName(variantName));
    }

    public List<Path> activate(TemplateVariant variant) {
        for (CertificateType type : CertificateType.values()) {
            Path source = templatePaths.variantFile(variant, type);
            if (!Files.isRegularFile(source)) {
                throw TemplateError.VARIANT_NOT_RENDERED.createException(variant.getVariantName(), source);
            }
        }

        List<Path> published = new ArrayList<>();
        for (CertificateType type : CertificateType.values()) {
            Path source = templatePaths.variantFile(variant, type);
            Path target = templatePaths.publishedFile(type);
            try {
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.error("Failed to publish {} as {}", source, target, e);
                throw TemplateError.TEMPLATE_COPY_FAILED.createException(e, source, target, e.getMessage());
            }
            published.add(target);
        }

        log.info("Activated pdf template variant: {}", variant.getVariantName());
        return published;
    }
}
