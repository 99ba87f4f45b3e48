package uk.gegc.railintel.features.ai.application;

import java.util.Map;

public interface PromptTemplateService {

    /**
     * Loads a template from {@code classpath:prompts/} and replaces {@code {placeholder}} tokens.
     *
     * @param templateName file name under the prompts directory, e.g. {@code chunk-analysis.txt}
     * @param values       placeholder values; missing placeholders are left untouched
     */
    String render(String templateName, Map<String, String> values);

    String loadTemplate(String templateName);
}
