package uk.gegc.railintel.features.analysis.domain.model;

import java.util.Set;
import java.util.TreeSet;

/**
 * Text produced by the OCR collaborator for one processing request.
 */
public record Document(
        String text,
        Set<String> languages,
        int pageCount
) {
    public Document {
        text = text == null ? "" : text;
        languages = languages == null ? Set.of() : Set.copyOf(new TreeSet<>(languages));
        pageCount = Math.max(0, pageCount);
    }

    public int totalCharacters() {
        return text.length();
    }
}
