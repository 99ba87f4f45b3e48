package uk.gegc.railintel.features.ai.application;

/**
 * Single entry point for every language-model call made by the application.
 * Abstracts away the provider for testability.
 */
public interface LlmClient {

    /**
     * Sends a prompt with optional supporting context and returns the completion text.
     *
     * @param prompt  the instruction or user message
     * @param context supporting material sent ahead of the prompt, may be {@code null}
     * @return non-blank completion text
     * @throws uk.gegc.railintel.shared.exception.AiConfigurationException if no credentials are configured
     * @throws uk.gegc.railintel.shared.exception.RateLimitedException     if throttling outlasted every retry
     * @throws uk.gegc.railintel.shared.exception.ProviderException        on any non-transient failure
     */
    String call(String prompt, String context);

    /**
     * @return true when provider credentials are present, so {@link #call} can reach the network
     */
    boolean isConfigured();
}
