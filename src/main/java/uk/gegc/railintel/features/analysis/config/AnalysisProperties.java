package uk.gegc.railintel.features.analysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tuning for the chunked analysis pipeline.
 */
@Configuration
@ConfigurationProperties(prefix = "railintel.analysis")
@Data
public class AnalysisProperties {

    /**
     * Token budget for a single chunk. Documents above it are split.
     */
    private int maxTokensPerChunk = 3_000;

    /**
     * Characters of each chunk quoted in a fallback summary.
     */
    private int fallbackExcerptChars = 300;

    /**
     * Upper bound on the document-level summary length.
     */
    private int synthesisMaxChars = 2_000;

    /**
     * Wall-clock budget for one document's chunk calls. Chunks not started in time are skipped.
     */
    private Duration processingBudget = Duration.ofMinutes(5);

    private int maxKeyItemsPerCategory = 10;
}
