package uk.gegc.railintel.features.analysis.domain.model;

import java.util.Locale;

public enum ClassificationMode {
    RAILWAY,
    GENERAL,
    BOTH;

    /**
     * Parses the wire value, defaulting to {@link #RAILWAY} for blank or unknown input.
     */
    public static ClassificationMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return RAILWAY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return RAILWAY;
        }
    }

    public boolean includesRailway() {
        return this != GENERAL;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
