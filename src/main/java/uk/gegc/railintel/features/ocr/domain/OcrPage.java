package uk.gegc.railintel.features.ocr.domain;

/**
 * One page of extracted text.
 *
 * @param pageNumber 1-based within its file
 * @param language   detected language tag, e.g. {@code eng}, {@code mal} or {@code unknown}
 */
public record OcrPage(int pageNumber, String text, String language) {

    public OcrPage {
        text = text == null ? "" : text;
        language = language == null ? "unknown" : language;
    }
}
