package uk.gegc.railintel.features.analysis.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Estimates model tokens from character counts.
 * <p>
 * Rule of thumb: 1 token ≈ 4 characters of English text. The same ratio is used when sizing
 * chunks and when reporting their estimated size, so a chunk built to a budget never reports more
 * than that budget.
 */
@Component
@Slf4j
public class TokenCounter {

    static final int CHARS_PER_TOKEN = 4;

    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimateTokens(text.length());
    }

    public int estimateTokens(int charCount) {
        if (charCount <= 0) {
            return 0;
        }
        return (charCount + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * @return the largest character count whose estimate stays within {@code maxTokens}
     */
    public int maxCharsForTokens(int maxTokens) {
        if (maxTokens <= 0) {
            return 0;
        }
        long chars = (long) maxTokens * CHARS_PER_TOKEN;
        return (int) Math.min(chars, Integer.MAX_VALUE);
    }

    public boolean exceedsTokenLimit(String text, int maxTokens) {
        int estimatedTokens = estimateTokens(text);
        boolean exceeds = estimatedTokens > maxTokens;
        if (exceeds) {
            log.debug("Text with {} estimated tokens exceeds limit of {} tokens", estimatedTokens, maxTokens);
        }
        return exceeds;
    }
}
