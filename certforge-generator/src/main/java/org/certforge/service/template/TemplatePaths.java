package org.certforge.service.template;

import org.certforge.config.TemplateProperties;
import org.certforge.model.enums.CertificateType;
import org.certforge.model.enums.TemplateVariant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Output layout: {@code <root>/variants/<variant>/<type>.png} for rendered variants,
 * {@code <root>/<type>.png} for the published one.
 */
@Component
public class TemplatePaths {

    private final Path templateRoot;

    @Autowired
    public TemplatePaths(TemplateProperties properties) {
        this(properties.templateRoot());
    }

    public TemplatePaths(Path templateRoot) {
        this.templateRoot = templateRoot;
    }

    public Path variantDir(TemplateVariant variant) {
        return templateRoot.resolve("variants").resolve(variant.getVariantName());
    }

    public Path variantFile(TemplateVariant variant, CertificateType type) {
        return variantDir(variant).resolve(type.fileName());
    }

    public Path publishedFile(CertificateType type) {
        return templateRoot.resolve(type.fileName());
    }
}
