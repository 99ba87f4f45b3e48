package uk.gegc.railintel.features.chat.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.analysis.application.KeyInformationExtractor;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;
import uk.gegc.railintel.features.chat.config.ChatProperties;
import uk.gegc.railintel.features.chat.domain.ChatIntent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Answers chat questions from an analysis without calling the model. Always returns non-empty text:
 * either a stored field matching the question, or an honest statement that the answer is not known.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuleBasedChatResponder {

    static final String NO_DOCUMENT_RESPONSE =
            "No processed document is available yet. Upload and process a railway document first, "
                    + "then ask about its type, its summary, the dates it mentions or its safety and compliance content.";
    static final String NOT_ENOUGH_INFORMATION =
            "I don't have enough information in the processed document to answer that. "
                    + "You can ask about the document type, its summary, the dates it mentions "
                    + "or its safety and compliance content.";

    private static final int MAX_LISTED_ITEMS = 10;

    private final ChatProperties chatProperties;

    public String respond(String message, AnalysisResult analysis) {
        if (analysis == null) {
            return NO_DOCUMENT_RESPONSE;
        }
        Optional<ChatIntent> intent = ChatIntent.detect(message);
        log.debug("Rule-based chat intent: {}", intent.map(Enum::name).orElse("none"));
        if (intent.isEmpty()) {
            return NOT_ENOUGH_INFORMATION;
        }
        return switch (intent.get()) {
            case DATE -> answerDates(analysis);
            case SAFETY_COMPLIANCE -> answerSafetyCompliance(analysis);
            case DOCUMENT_TYPE -> answerDocumentType(analysis);
            case SUMMARY -> answerSummary(analysis);
        };
    }

    private String answerDates(AnalysisResult analysis) {
        List<String> dates = analysis.keyInformation().getOrDefault(KeyInformationExtractor.DATES, List.of());
        if (dates.isEmpty()) {
            return "I could not find any specific dates in the processed document.";
        }
        return "The document mentions the following dates:\n" + bulletList(dates);
    }

    private String answerSafetyCompliance(AnalysisResult analysis) {
        List<String> notes = new ArrayList<>();
        notes.addAll(analysis.keyInformation().getOrDefault(KeyInformationExtractor.SAFETY_NOTES, List.of()));
        notes.addAll(analysis.keyInformation().getOrDefault(KeyInformationExtractor.COMPLIANCE_REFERENCES, List.of()));

        List<String> categories = analysis.classification().stream()
                .filter(entry -> entry.category() == DocumentCategory.SAFETY_MANUAL
                        || entry.category() == DocumentCategory.COMPLIANCE_REGULATORY)
                .map(this::describe)
                .toList();

        if (notes.isEmpty() && categories.isEmpty()) {
            return "I could not find safety or compliance content in the processed document.";
        }
        StringBuilder answer = new StringBuilder();
        if (!categories.isEmpty()) {
            answer.append("Safety and compliance classification: ").append(String.join(", ", categories)).append('.');
        }
        if (!notes.isEmpty()) {
            if (!answer.isEmpty()) {
                answer.append("\n\n");
            }
            answer.append("Relevant passages:\n").append(bulletList(notes));
        }
        return answer.toString();
    }

    private String answerDocumentType(AnalysisResult analysis) {
        String type = analysis.documentType().isBlank() ? null : analysis.documentType();
        List<ClassificationEntry> top = analysis.topClassification(chatProperties.getTopCategories());
        if (type == null && top.isEmpty()) {
            return NOT_ENOUGH_INFORMATION;
        }
        StringBuilder answer = new StringBuilder("Based on the analysis, this appears to be a **")
                .append(type != null ? type : top.get(0).label())
                .append("**.");
        if (!top.isEmpty()) {
            answer.append(" Top categories: ")
                    .append(String.join(", ", top.stream().map(this::describe).toList()))
                    .append('.');
        }
        return answer.toString();
    }

    private String answerSummary(AnalysisResult analysis) {
        if (analysis.summary().isBlank()) {
            return "No summary is available for the processed document.";
        }
        return analysis.summary();
    }

    private String describe(ClassificationEntry entry) {
        return String.format(Locale.ROOT, "%s (%.0f%%)", entry.label(), entry.confidence() * 100);
    }

    private String bulletList(List<String> items) {
        StringBuilder list = new StringBuilder();
        items.stream().limit(MAX_LISTED_ITEMS).forEach(item -> list.append("• ").append(item).append('\n'));
        return list.toString().stripTrailing();
    }
}
