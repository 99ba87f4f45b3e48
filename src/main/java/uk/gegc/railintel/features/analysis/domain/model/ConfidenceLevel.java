package uk.gegc.railintel.features.analysis.domain.model;

public enum ConfidenceLevel {
    VERY_HIGH("Very High", 0.9),
    HIGH("High", 0.7),
    MEDIUM("Medium", 0.5),
    LOW("Low", 0.3),
    VERY_LOW("Very Low", 0.0);

    private final String description;
    private final double lowerBound;

    ConfidenceLevel(String description, double lowerBound) {
        this.description = description;
        this.lowerBound = lowerBound;
    }

    public static ConfidenceLevel of(double confidence) {
        for (ConfidenceLevel level : values()) {
            if (confidence >= level.lowerBound) {
                return level;
            }
        }
        return VERY_LOW;
    }

    public String getDescription() {
        return description;
    }
}
