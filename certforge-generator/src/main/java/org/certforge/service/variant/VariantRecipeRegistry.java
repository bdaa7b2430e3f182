package org.certforge.service.variant;

import lombok.RequiredArgsConstructor;
import org.certforge.exception.TemplateError;
import org.certforge.model.enums.TemplateVariant;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class VariantRecipeRegistry {

    private final Map<TemplateVariant, VariantRecipe> recipeMap;

    public VariantRecipe get(String variantName) {
        return get(TemplateVariant.fromName(variantName));
    }

    public VariantRecipe get(TemplateVariant variant) {
        VariantRecipe recipe = recipeMap.get(variant);
        if (recipe == null) {
            throw TemplateError.UNKNOWN_VARIANT.createException(variant.getVariantName(), String.join(", ", TemplateVariant.names()));
        }
        return recipe;
    }
}
