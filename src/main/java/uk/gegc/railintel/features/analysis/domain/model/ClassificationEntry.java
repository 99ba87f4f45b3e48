package uk.gegc.railintel.features.analysis.domain.model;

public record ClassificationEntry(
        DocumentCategory category,
        double confidence,
        double operatorRelevance
) {
    public ClassificationEntry {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
    }

    public String label() {
        return category.getLabel();
    }
}
