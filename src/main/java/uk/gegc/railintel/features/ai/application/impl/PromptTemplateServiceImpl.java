package uk.gegc.railintel.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.ai.application.PromptTemplateService;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    private static final String PROMPTS_LOCATION = "classpath:prompts/";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    /**
     * Single pass over the template, so braces inside substituted values are never expanded.
     */
    @Override
    public String render(String templateName, Map<String, String> values) {
        String template = loadTemplate(templateName);
        if (values == null || values.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = values.containsKey(name)
                    ? (values.get(name) == null ? "" : values.get(name))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public String loadTemplate(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be null or empty");
        }
        return templateCache.computeIfAbsent(templateName, this::readTemplate);
    }

    private String readTemplate(String templateName) {
        Resource resource = resourceLoader.getResource(PROMPTS_LOCATION + templateName);
        try (InputStream inputStream = resource.getInputStream()) {
            String template = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Loaded prompt template {} ({} chars)", templateName, template.length());
            return template;
        } catch (IOException e) {
            log.error("Failed to load prompt template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load prompt template: " + templateName, e);
        }
    }
}
