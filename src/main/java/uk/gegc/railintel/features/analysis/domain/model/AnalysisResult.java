package uk.gegc.railintel.features.analysis.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Document-level result of one processing request. Immutable; shared read-only with chat.
 */
public record AnalysisResult(
        String documentType,
        String summary,
        String ocrText,
        List<ClassificationEntry> classification,
        Map<String, List<String>> keyInformation,
        ClassificationInsights insights,
        AnalysisMetadata metadata
) {
    public AnalysisResult {
        documentType = documentType == null ? "" : documentType;
        summary = summary == null ? "" : summary;
        ocrText = ocrText == null ? "" : ocrText;
        classification = classification == null ? List.of() : List.copyOf(classification);
        keyInformation = KeyInformationMaps.copyOf(keyInformation);
    }

    public List<ClassificationEntry> topClassification(int limit) {
        return classification.subList(0, Math.min(Math.max(0, limit), classification.size()));
    }
}
