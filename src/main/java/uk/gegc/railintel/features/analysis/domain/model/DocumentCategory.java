package uk.gegc.railintel.features.analysis.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed set of railway document categories. Each constant carries its own scoring rule:
 * keyword coverage of the text, scaled by the category weight and capped at 1.
 */
public enum DocumentCategory {

    SAFETY_MANUAL("Safety Manual", 1.2, List.of(
            "safety", "hazard", "risk", "emergency", "accident", "incident",
            "emergency response", "safety protocol", "hazard identification",
            "risk assessment", "safety training", "accident prevention",
            "occupational safety", "personal protective equipment", "ppe",
            "emergency evacuation", "fire safety", "first aid")),

    TECHNICAL_DOCUMENTATION("Technical Documentation", 1.0, List.of(
            "specifications", "technical", "engineering", "maintenance", "repair",
            "technical specifications", "engineering drawings", "maintenance manual",
            "repair procedures", "technical standards", "system specifications",
            "component specifications", "installation guide", "troubleshooting",
            "calibration", "testing procedures", "quality control")),

    OPERATIONAL_PROCEDURES("Operational Procedures", 1.1, List.of(
            "operation", "procedure", "protocol", "guideline", "instruction",
            "operating procedures", "standard operating procedure", "sop",
            "operational guidelines", "work instructions", "process flow",
            "operational manual", "duty instructions", "shift procedures",
            "operational safety", "control procedures")),

    SCHEDULE_TIMETABLE("Schedule Timetable", 0.9, List.of(
            "schedule", "timetable", "departure", "arrival", "route",
            "train schedule", "service timetable", "departure time",
            "arrival time", "route map", "frequency", "service interval",
            "peak hours", "off-peak", "holiday schedule", "special service")),

    COMPLIANCE_REGULATORY("Compliance Regulatory", 1.1, List.of(
            "compliance", "regulation", "standard", "requirement", "audit",
            "regulatory compliance", "safety standards", "industry standards",
            "compliance audit", "regulatory requirements", "certification",
            "inspection", "quality assurance", "standard procedures",
            "legal requirements", "regulatory framework")),

    TRAINING_MANUAL("Training Manual", 0.8, List.of(
            "training", "education", "course", "certification", "qualification",
            "training manual", "training program", "educational material",
            "certification course", "qualification requirements", "skill development",
            "competency", "learning objectives", "training schedule",
            "assessment", "examination", "practical training")),

    INFRASTRUCTURE("Infrastructure", 1.0, List.of(
            "track", "signal", "station", "platform", "bridge", "tunnel",
            "railway track", "signaling system", "station infrastructure",
            "platform design", "bridge construction", "tunnel engineering",
            "overhead lines", "power supply", "track maintenance",
            "signal maintenance", "infrastructure development",
            "civil engineering", "structural design")),

    ROLLING_STOCK("Rolling Stock", 1.0, List.of(
            "locomotive", "coach", "wagon", "train", "vehicle",
            "rolling stock", "train composition", "locomotive maintenance",
            "coach design", "passenger coach", "freight wagon",
            "multiple unit", "emu", "dmu", "electric multiple unit",
            "diesel multiple unit", "bogies", "traction system")),

    PASSENGER_SERVICES("Passenger Services", 0.7, List.of(
            "passenger", "ticket", "booking", "service", "customer",
            "passenger services", "ticketing system", "reservation",
            "customer service", "passenger amenities", "accessibility",
            "passenger information", "announcements", "passenger safety",
            "boarding", "alighting", "passenger comfort")),

    FREIGHT_OPERATIONS("Freight Operations", 0.8, List.of(
            "freight", "cargo", "goods", "loading", "unloading",
            "freight operations", "cargo handling", "goods transportation",
            "loading procedures", "unloading procedures", "freight yard",
            "cargo terminal", "container handling", "bulk cargo",
            "freight scheduling", "goods wagon")),

    SIGNALING_COMMUNICATION("Signaling Communication", 1.1, List.of(
            "signaling", "communication", "control", "interlocking", "block",
            "signal control", "communication system", "train control",
            "automatic block signaling", "centralized traffic control",
            "radio communication", "data communication", "control room",
            "dispatching", "train detection", "level crossing")),

    ELECTRICAL_SYSTEMS("Electrical Systems", 1.0, List.of(
            "electrical", "power", "traction", "substation", "overhead",
            "electrical system", "power supply", "traction power",
            "electrical substation", "overhead equipment", "pantograph",
            "electrical maintenance", "power distribution", "25kv",
            "electrical safety", "earthing", "insulation")),

    /**
     * Reported only when no scored category reaches the minimum confidence.
     */
    GENERAL_RAILWAY_DOCUMENT("General Railway Document", 0.0, List.of());

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double OCCURRENCE_BONUS = 0.1;

    private final String label;
    private final double weight;
    private final List<String> keywords;

    DocumentCategory(String label, double weight, List<String> keywords) {
        this.label = label;
        this.weight = weight;
        this.keywords = keywords;
    }

    /**
     * Rule-based evidence in [0,1] for text already passed through {@link #normalize(String)}.
     * Each matched keyword scores 1 plus a small bonus per occurrence; the total is taken as a
     * fraction of the keyword list and scaled by the category weight.
     */
    public double ruleSignal(String normalizedText) {
        if (keywords.isEmpty() || normalizedText == null || normalizedText.isEmpty()) {
            return 0.0;
        }
        double matched = 0.0;
        for (String keyword : keywords) {
            int occurrences = countOccurrences(normalizedText, keyword.replace('-', ' '));
            if (occurrences > 0) {
                matched += 1 + occurrences * OCCURRENCE_BONUS;
            }
        }
        return Math.min(matched / keywords.size() * weight, 1.0);
    }

    public boolean isScored() {
        return !keywords.isEmpty();
    }

    public String getLabel() {
        return label;
    }

    public double getWeight() {
        return weight;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a category from a key ({@code safety_manual}) or a label ({@code Safety Manual}),
     * ignoring case and separators.
     */
    public static Optional<DocumentCategory> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String wanted = value.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s/\\-]+", "_");
        for (DocumentCategory category : values()) {
            if (category.name().equals(wanted)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-cases, replaces punctuation with spaces and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    static int countOccurrences(String text, String keyword) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(keyword, from)) >= 0) {
            count++;
            from += keyword.length();
        }
        return count;
    }
}
