package uk.gegc.railintel.features.ocr.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Text extracted from one file, page by page.
 */
public record OcrExtraction(String fileName, List<OcrPage> pages) {

    public OcrExtraction {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public String text() {
        return pages.stream().map(OcrPage::text).collect(Collectors.joining("\n\n"));
    }

    public Set<String> languages() {
        return pages.stream().map(OcrPage::language).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }
}
