package uk.gegc.railintel.features.analysis.domain.model;

public enum ProcessingMode {
    /** Every chunk analysed by the model. */
    AI("ai"),
    /** Model-backed, but some chunks failed or the run was cut short. */
    AI_PARTIAL("ai_partial"),
    /** Deterministic rule-based analysis only. */
    FALLBACK("fallback");

    private final String value;

    ProcessingMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the matching mode, or {@link #FALLBACK} for an unknown value
     */
    public static ProcessingMode fromValue(String value) {
        for (ProcessingMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value == null ? "" : value.trim())) {
                return mode;
            }
        }
        return FALLBACK;
    }

    public boolean isDegraded() {
        return this != AI;
    }
}
