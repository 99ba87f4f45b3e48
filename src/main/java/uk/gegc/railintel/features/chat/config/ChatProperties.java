package uk.gegc.railintel.features.chat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Bounds on the context sent with a chat question.
 */
@Configuration
@ConfigurationProperties(prefix = "railintel.chat")
@Data
public class ChatProperties {

    /**
     * Classification entries included in the context.
     */
    private int topCategories = 3;

    /**
     * Most recent conversation turns included in the prompt.
     */
    private int historyTurns = 6;

    /**
     * Longest single earlier message kept in the prompt, in characters.
     */
    private int maxTurnChars = 1_000;

    /**
     * Upper bound on the whole conversation tail, in characters. Oldest turns are dropped first.
     */
    private int maxHistoryChars = 4_000;

    /**
     * Upper bound on the document context, in characters.
     */
    private int maxContextChars = 6_000;

    /**
     * Key-information items included in the context.
     */
    private int maxKeyEntries = 5;
}
