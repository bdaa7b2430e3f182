package org.certforge.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.certforge.model.dto.GenerationReport;
import org.certforge.model.enums.TemplateVariant;
import org.certforge.service.template.TemplateActivationService;
import org.certforge.service.template.TemplateGenerationService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line entry: a full generation pass by default, or {@code --activate=<variant>} to only republish an
 * already rendered variant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "certforge.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TemplateGenerationRunner implements ApplicationRunner {

    static final String ACTIVATE_OPTION = "activate";

    private final TemplateGenerationService generationService;
    private final TemplateActivationService activationService;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(ACTIVATE_OPTION)) {
            List<String> values = args.getOptionValues(ACTIVATE_OPTION);
            if (values == null || values.size() != 1 || StringUtils.isBlank(values.get(0))) {
                log.error("Usage: --{}=<variant>. Available variants: {}", ACTIVATE_OPTION, String.join(", ", TemplateVariant.names()));
                throw new IllegalArgumentException("Expected exactly one variant for --" + ACTIVATE_OPTION);
            }
            activationService.activate(values.get(0));
            return;
        }

        GenerationReport report = generationService.generateAll();
        log.info("Wrote {} rendered and {} published templates", report.getRenderedFiles().size(), report.getPublishedFiles().size());
    }
}
