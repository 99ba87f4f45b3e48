package uk.gegc.railintel.features.chat.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Question kinds the rule-based responder can answer from a stored analysis. A message matches the
 * intent with the most trigger words; ties go to the intent declared first.
 */
public enum ChatIntent {
    DATE(List.of("date", "dates", "when", "deadline", "deadlines", "timeline", "schedule", "dated")),
    SAFETY_COMPLIANCE(List.of("safety", "safe", "compliance", "compliant", "hazard", "hazards", "emergency",
            "regulation", "regulations", "regulatory", "audit", "risk", "risks")),
    DOCUMENT_TYPE(List.of("type", "kind", "category", "categories", "classification", "classified", "classify")),
    SUMMARY(List.of("summary", "summarize", "summarise", "overview", "gist", "about", "main", "points"));

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final List<String> triggers;

    ChatIntent(List<String> triggers) {
        this.triggers = triggers;
    }

    public List<String> getTriggers() {
        return triggers;
    }

    public static Optional<ChatIntent> detect(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        Set<String> words = WORD_SPLIT.splitAsStream(message.toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
        ChatIntent best = null;
        long bestScore = 0;
        for (ChatIntent intent : values()) {
            long score = intent.triggers.stream().filter(words::contains).count();
            if (score > bestScore) {
                best = intent;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }
}
