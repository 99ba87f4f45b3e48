package uk.gegc.railintel.features.ai.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.ai.application.PacingGate;
import uk.gegc.railintel.features.ai.application.Sleeper;
import uk.gegc.railintel.features.ai.infra.RateLimitedLlmClient;
import uk.gegc.railintel.shared.config.AiRateLimitConfig;

import java.time.Clock;

/**
 * Wires the shared pacing gate and the rate-limited client.
 * <p>
 * The provider model is built here rather than through auto-configuration so that a missing key
 * leaves the application running in fallback mode instead of failing at startup. Spring AI's
 * own retry is reduced to a single attempt; retrying is owned by {@link RateLimitedLlmClient}.
 */
@Configuration
@Slf4j
public class AiClientConfig {

    @Bean
    public PacingGate pacingGate(AiRateLimitConfig rateLimitConfig, Clock clock) {
        return new PacingGate(clock, Sleeper.system(), rateLimitConfig.getChunkDelay());
    }

    @Bean
    public LlmClient llmClient(AiProviderProperties providerProperties,
                               PacingGate pacingGate,
                               AiRateLimitConfig rateLimitConfig,
                               MeterRegistry meterRegistry) {
        ChatModel chatModel = null;
        if (providerProperties.hasCredentials()) {
            chatModel = buildChatModel(providerProperties);
            log.info("Language-model client configured: endpoint={}, model={}",
                    providerProperties.getEndpoint(), providerProperties.getModel());
        } else {
            log.warn("No valid language-model credentials configured; analysis and chat will use fallback mode");
        }
        return new RateLimitedLlmClient(chatModel, pacingGate, rateLimitConfig, Sleeper.system(), meterRegistry);
    }

    private ChatModel buildChatModel(AiProviderProperties properties) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(properties.getEndpoint().trim())
                .completionsPath(properties.getCompletionsPath())
                .apiKey(properties.getApiKey().trim())
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(properties.getModel())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxResponseTokens())
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
