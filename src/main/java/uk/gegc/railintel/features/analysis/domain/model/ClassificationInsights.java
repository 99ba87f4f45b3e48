package uk.gegc.railintel.features.analysis.domain.model;

import java.util.List;

/**
 * Summary view over a classification list, used by the results view and the chat responder.
 */
public record ClassificationInsights(
        String primaryCategory,
        double primaryConfidence,
        ConfidenceLevel confidenceLevel,
        int highConfidenceCount,
        double operatorRelevance,
        boolean operatorDocument,
        int categoryCount
) {
    static final double HIGH_CONFIDENCE = 0.7;
    static final double OPERATOR_DOCUMENT_THRESHOLD = 0.3;

    /**
     * @return insights for the list, or {@code null} when there is nothing to describe
     */
    public static ClassificationInsights from(List<ClassificationEntry> classification) {
        if (classification == null || classification.isEmpty()) {
            return null;
        }
        ClassificationEntry top = classification.get(0);
        int highConfidence = (int) classification.stream()
                .filter(entry -> entry.confidence() >= HIGH_CONFIDENCE)
                .count();
        return new ClassificationInsights(
                top.label(),
                top.confidence(),
                ConfidenceLevel.of(top.confidence()),
                highConfidence,
                top.operatorRelevance(),
                top.operatorRelevance() > OPERATOR_DOCUMENT_THRESHOLD,
                classification.size()
        );
    }
}
