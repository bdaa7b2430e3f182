package org.certforge.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.certforge.exception.TemplateError;

import java.util.Arrays;
import java.util.List;

@RequiredArgsConstructor
@Getter
public enum TemplateVariant {
    ADVENTURE("adventure"),
    MEDAL_FES("medal-fes"),
    SWIM_HERO("swim-hero");

    private final String variantName;

    public static TemplateVariant fromName(String name) {
        return Arrays.stream(values())
                .filter(v -> StringUtils.equals(v.variantName, name))
                .findFirst()
                .orElseThrow(() -> TemplateError.UNKNOWN_VARIANT.createException(name, String.join(", ", names())));
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(TemplateVariant::getVariantName).toList();
    }
}
