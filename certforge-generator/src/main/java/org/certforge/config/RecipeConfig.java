package org.certforge.config;

import org.certforge.model.enums.TemplateVariant;
import org.certforge.service.variant.AdventureRecipe;
import org.certforge.service.variant.MedalFesRecipe;
import org.certforge.service.variant.SwimHeroRecipe;
import org.certforge.service.variant.VariantRecipe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class RecipeConfig {

    @Bean
    public Map<TemplateVariant, VariantRecipe> recipeMap(AdventureRecipe adventureRecipe, MedalFesRecipe medalFesRecipe,
                                                         SwimHeroRecipe swimHeroRecipe) {
        return Map.of(
                TemplateVariant.ADVENTURE, adventureRecipe,
                TemplateVariant.MEDAL_FES, medalFesRecipe,
                TemplateVariant.SWIM_HERO, swimHeroRecipe
        );
    }
}
