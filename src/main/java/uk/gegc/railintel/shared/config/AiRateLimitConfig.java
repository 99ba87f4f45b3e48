package uk.gegc.railintel.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for pacing and retrying language-model calls.
 */
@Component
@ConfigurationProperties(prefix = "railintel.ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Minimum spacing between the start of two consecutive provider calls, process-wide.
     */
    private Duration chunkDelay = Duration.ofSeconds(1);

    /**
     * Fixed wait after the provider signals throttling, before the next attempt.
     */
    private Duration rateLimitRetryDelay = Duration.ofSeconds(10);

    /**
     * Number of retries after a throttled attempt. Total attempts = maxRetries + 1.
     */
    private int maxRetries = 3;
}
