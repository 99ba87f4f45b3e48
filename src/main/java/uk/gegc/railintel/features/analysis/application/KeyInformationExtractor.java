package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured facts out of document text with rules, and merges them with what the model
 * reported per chunk. Categories are keyed in snake_case and listed in a fixed order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeyInformationExtractor {

    public static final String DATES = "dates";
    public static final String VERSIONS = "versions";
    public static final String HEADINGS = "headings";
    public static final String SAFETY_NOTES = "safety_notes";
    public static final String COMPLIANCE_REFERENCES = "compliance_references";

    private static final String MONTHS =
            "(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?"
                    + "|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";

    private static final Pattern DATE = Pattern.compile(
            "\\b\\d{1,2}(?:st|nd|rd|th)?\\s+" + MONTHS + "\\.?,?\\s+\\d{4}\\b"
                    + "|\\b" + MONTHS + "\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4}\\b"
                    + "|\\b\\d{4}-\\d{2}-\\d{2}\\b"
                    + "|\\b\\d{1,2}[/.]\\d{1,2}[/.]\\d{2,4}\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern VERSION = Pattern.compile(
            "\\b(?:version|ver\\.|revision|rev\\.)\\s*:?\\s*\\d+(?:\\.\\d+)*\\b|\\bv\\d+(?:\\.\\d+)+\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBERED_HEADING = Pattern.compile("^\\d+(?:\\.\\d+)*\\.?\\s+\\p{Lu}.*$");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");

    private static final List<String> SAFETY_TERMS = List.of(
            "safety", "emergency", "hazard", "evacuat", "accident", "fire", "injur", "protective");
    private static final List<String> COMPLIANCE_TERMS = List.of(
            "complian", "regulat", "standard", "certif", "audit", "inspection", "statutory");

    private static final int MAX_HEADING_CHARS = 80;
    private static final int MAX_HEADING_WORDS = 10;
    private static final int MIN_NOTE_CHARS = 20;
    private static final int MAX_NOTE_CHARS = 300;

    private final AnalysisProperties properties;

    /**
     * Rule-based extraction over the whole text. Only non-empty categories are returned.
     */
    public Map<String, List<String>> extract(String text) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        putIfNotEmpty(result, DATES, extractDates(text));
        putIfNotEmpty(result, VERSIONS, matches(VERSION, text));
        putIfNotEmpty(result, HEADINGS, extractHeadings(text));
        List<String> sentences = sentences(text);
        putIfNotEmpty(result, SAFETY_NOTES, sentencesMentioning(sentences, SAFETY_TERMS));
        putIfNotEmpty(result, COMPLIANCE_REFERENCES, sentencesMentioning(sentences, COMPLIANCE_TERMS));
        return result;
    }

    /**
     * Combines model-reported items (first, in chunk order) with rule-based ones. Items are
     * trimmed, de-duplicated ignoring case and capped per category.
     */
    public Map<String, List<String>> merge(List<ChunkResult> chunkResults, Map<String, List<String>> ruleBased) {
        Map<String, Set<String>> seen = new LinkedHashMap<>();
        Map<String, List<String>> merged = new LinkedHashMap<>();
        int cap = Math.max(1, properties.getMaxKeyItemsPerCategory());

        if (chunkResults != null) {
            for (ChunkResult result : chunkResults) {
                if (result.success()) {
                    result.keyInformation().forEach((key, items) -> addAll(merged, seen, normalizeKey(key), items, cap));
                }
            }
        }
        if (ruleBased != null) {
            ruleBased.forEach((key, items) -> addAll(merged, seen, normalizeKey(key), items, cap));
        }
        merged.values().removeIf(List::isEmpty);
        return merged;
    }

    public List<String> extractDates(String text) {
        return matches(DATE, text);
    }

    /**
     * Lines that look like section headings: numbered titles ({@code 2.1 Emergency Exits}) or short
     * all-capitals lines.
     */
    public List<String> extractHeadings(String text) {
        List<String> headings = new ArrayList<>();
        if (text == null) {
            return headings;
        }
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.length() < 3 || line.length() > MAX_HEADING_CHARS
                    || line.split("\\s+").length > MAX_HEADING_WORDS) {
                continue;
            }
            if (NUMBERED_HEADING.matcher(line).matches() || isAllCapitals(line)) {
                headings.add(line);
            }
        }
        return distinct(headings);
    }

    private boolean isAllCapitals(String line) {
        int letters = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                letters++;
            }
        }
        return letters >= 3;
    }

    private List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String paragraph : text.split("\\n\\s*\\n")) {
            String flattened = paragraph.replaceAll("\\s+", " ").trim();
            for (String sentence : SENTENCE_SPLIT.split(flattened)) {
                String candidate = sentence.trim();
                if (candidate.length() >= MIN_NOTE_CHARS && candidate.length() <= MAX_NOTE_CHARS) {
                    sentences.add(candidate);
                }
            }
        }
        return sentences;
    }

    private List<String> sentencesMentioning(List<String> sentences, List<String> terms) {
        List<String> found = new ArrayList<>();
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (terms.stream().anyMatch(lower::contains)) {
                found.add(sentence);
            }
        }
        return distinct(found);
    }

    private List<String> matches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().replaceAll("\\s+", " ").trim());
        }
        return distinct(found);
    }

    private List<String> distinct(List<String> items) {
        Set<String> keys = new LinkedHashSet<>();
        List<String> unique = new ArrayList<>();
        for (String item : items) {
            if (keys.add(item.toLowerCase(Locale.ROOT))) {
                unique.add(item);
            }
        }
        return unique;
    }

    private void putIfNotEmpty(Map<String, List<String>> target, String key, List<String> items) {
        if (!items.isEmpty()) {
            target.put(key, items);
        }
    }

    private void addAll(Map<String, List<String>> merged, Map<String, Set<String>> seen,
                        String key, List<String> items, int cap) {
        if (key.isEmpty() || items == null) {
            return;
        }
        List<String> target = merged.computeIfAbsent(key, k -> new ArrayList<>());
        Set<String> keys = seen.computeIfAbsent(key, k -> new LinkedHashSet<>());
        for (String item : items) {
            if (target.size() >= cap) {
                return;
            }
            if (item == null || item.isBlank()) {
                continue;
            }
            String trimmed = item.trim();
            if (keys.add(trimmed.toLowerCase(Locale.ROOT))) {
                target.add(trimmed);
            }
        }
    }

    static String normalizeKey(String key) {
        if (key == null) {
            return "";
        }
        return key.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }
}
