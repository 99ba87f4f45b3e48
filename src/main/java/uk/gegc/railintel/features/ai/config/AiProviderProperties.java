package uk.gegc.railintel.features.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.net.URI;

/**
 * Language-model provider connection settings.
 */
@Configuration
@ConfigurationProperties(prefix = "railintel.ai")
@Data
public class AiProviderProperties {

    /**
     * Base URL of an OpenAI-compatible chat completions API.
     */
    private String endpoint = "https://models.inference.ai.azure.com";

    /**
     * Path of the chat completions resource under {@link #endpoint}.
     */
    private String completionsPath = "/chat/completions";

    /**
     * Provider credential. Blank means every call goes through fallback mode.
     */
    private String apiKey = "";

    private String model = "gpt-4o-mini";

    private double temperature = 0.3;

    private int maxResponseTokens = 1000;

    /**
     * Credentials are usable when a key is present and the endpoint is an absolute http(s) URL.
     */
    public boolean hasCredentials() {
        if (apiKey == null || apiKey.isBlank() || endpoint == null || endpoint.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(endpoint.trim());
            return uri.isAbsolute() && ("https".equals(uri.getScheme()) || "http".equals(uri.getScheme()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
