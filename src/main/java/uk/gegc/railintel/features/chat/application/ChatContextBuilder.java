package uk.gegc.railintel.features.chat.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.ai.application.PromptTemplateService;
import uk.gegc.railintel.features.ai.domain.CallAttempt;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.chat.config.ChatProperties;
import uk.gegc.railintel.features.chat.domain.ChatReply;
import uk.gegc.railintel.features.chat.domain.ChatTurn;
import uk.gegc.railintel.shared.util.TextExcerpts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Answers a chat question about a processed document.
 * <p>
 * The model sees a bounded context: the summary, the top classification entries, the key-information
 * items sharing the most words with the question, and the last few conversation turns. Any failure
 * or blank reply from the model falls through to {@link RuleBasedChatResponder}; callers always get
 * a non-empty answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatContextBuilder {

    static final String SYSTEM_TEMPLATE = "chat-system.txt";
    static final String QUESTION_TEMPLATE = "chat-question.txt";
    static final String NO_DOCUMENT_CONTEXT = "No document has been processed yet.";
    static final String NO_EARLIER_MESSAGES = "(no earlier messages)";

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "are", "for", "with", "what", "which", "this", "that", "from", "there",
            "does", "was", "were", "have", "has", "any", "about", "mentioned", "document", "tell");
    private static final int MIN_WORD_LENGTH = 3;

    private final LlmClient llmClient;
    private final PromptTemplateService promptTemplateService;
    private final RuleBasedChatResponder ruleBasedChatResponder;
    private final ChatProperties chatProperties;

    public ChatReply respond(String message, AnalysisResult analysis, List<ChatTurn> history) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message cannot be null or empty");
        }
        if (llmClient.isConfigured()) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable(CallAttempt.CALL_REF_KEY, "chat")) {
                String context = promptTemplateService.render(SYSTEM_TEMPLATE,
                        Map.of("document_context", buildContext(message, analysis)));
                String prompt = promptTemplateService.render(QUESTION_TEMPLATE, Map.of(
                        "history", buildConversation(history),
                        "message", message.trim()));
                String reply = llmClient.call(prompt, context);
                if (reply != null && !reply.isBlank()) {
                    return new ChatReply(reply.trim(), true);
                }
                log.warn("Model returned a blank chat reply; using rule-based responder");
            } catch (RuntimeException e) {
                log.warn("Chat model call failed ({}); using rule-based responder", e.getMessage());
            }
        }
        return new ChatReply(ruleBasedChatResponder.respond(message, analysis), false);
    }

    /**
     * Document context for the model, never longer than the configured maximum.
     */
    public String buildContext(String message, AnalysisResult analysis) {
        if (analysis == null) {
            return NO_DOCUMENT_CONTEXT;
        }
        int maxChars = Math.max(200, chatProperties.getMaxContextChars());
        StringBuilder context = new StringBuilder();

        if (!analysis.documentType().isBlank()) {
            context.append("Document type: ").append(analysis.documentType()).append("\n\n");
        }
        if (!analysis.summary().isBlank()) {
            context.append("Summary:\n")
                    .append(TextExcerpts.truncateAtSentence(analysis.summary(), maxChars / 2))
                    .append("\n\n");
        }

        List<ClassificationEntry> top = analysis.topClassification(chatProperties.getTopCategories());
        if (!top.isEmpty()) {
            context.append("Classification:\n");
            for (ClassificationEntry entry : top) {
                context.append(String.format(Locale.ROOT, "- %s: %.2f%n", entry.label(), entry.confidence()));
            }
            context.append('\n');
        }

        List<KeyEntry> keyEntries = relevantKeyEntries(message, analysis.keyInformation());
        if (!keyEntries.isEmpty()) {
            context.append("Key information:\n");
            for (KeyEntry entry : keyEntries) {
                context.append("- ").append(entry.category()).append(": ").append(entry.item()).append('\n');
            }
        }

        String built = context.toString().trim();
        return built.length() <= maxChars ? built : TextExcerpts.truncateAtSentence(built, maxChars);
    }

    /**
     * The last configured number of turns, oldest first. Each turn is cut to the per-turn limit and
     * the oldest turns are dropped until the whole tail fits the history limit.
     */
    public String buildConversation(List<ChatTurn> history) {
        if (history == null || history.isEmpty()) {
            return NO_EARLIER_MESSAGES;
        }
        int keep = Math.max(0, chatProperties.getHistoryTurns());
        int maxTurnChars = Math.max(1, chatProperties.getMaxTurnChars());
        int maxHistoryChars = Math.max(1, chatProperties.getMaxHistoryChars());

        List<ChatTurn> tail = history.subList(Math.max(0, history.size() - keep), history.size());
        Deque<String> lines = new ArrayDeque<>();
        int length = 0;
        for (ChatTurn turn : tail) {
            if (!turn.content().isBlank()) {
                String line = turn.speaker() + ": " + TextExcerpts.truncateAtSentence(turn.content(), maxTurnChars);
                lines.addLast(line);
                length += line.length() + (lines.size() > 1 ? 1 : 0);
            }
        }
        while (lines.size() > 1 && length > maxHistoryChars) {
            length -= lines.removeFirst().length() + 1;
        }
        if (lines.isEmpty()) {
            return NO_EARLIER_MESSAGES;
        }
        String conversation = String.join("\n", lines);
        return conversation.length() <= maxHistoryChars
                ? conversation
                : TextExcerpts.truncateAtSentence(conversation, maxHistoryChars);
    }

    /**
     * Items ranked by words shared with the message, counting the category name as part of each
     * item. Ties keep document order. When nothing overlaps, the first items are used.
     */
    List<KeyEntry> relevantKeyEntries(String message, Map<String, List<String>> keyInformation) {
        List<KeyEntry> entries = new ArrayList<>();
        if (keyInformation == null || keyInformation.isEmpty()) {
            return entries;
        }
        Set<String> messageWords = words(message);
        int order = 0;
        for (Map.Entry<String, List<String>> category : keyInformation.entrySet()) {
            Set<String> categoryWords = words(category.getKey().replace('_', ' '));
            for (String item : category.getValue()) {
                Set<String> itemWords = words(item);
                itemWords.addAll(categoryWords);
                itemWords.retainAll(messageWords);
                entries.add(new KeyEntry(category.getKey(), item, itemWords.size(), order++));
            }
        }

        int limit = Math.max(0, chatProperties.getMaxKeyEntries());
        boolean anyOverlap = entries.stream().anyMatch(entry -> entry.score() > 0);
        return entries.stream()
                .filter(entry -> !anyOverlap || entry.score() > 0)
                .sorted(Comparator.comparingInt(KeyEntry::score).reversed().thenComparingInt(KeyEntry::order))
                .limit(limit)
                .toList();
    }

    private static Set<String> words(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        for (String word : WORD_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
                words.add(stem(word));
            }
        }
        return words;
    }

    private static String stem(String word) {
        return word.length() > 3 && word.endsWith("s") ? word.substring(0, word.length() - 1) : word;
    }

    record KeyEntry(String category, String item, int score, int order) {
    }
}
