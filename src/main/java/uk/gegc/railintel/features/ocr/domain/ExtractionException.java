package uk.gegc.railintel.features.ocr.domain;

/**
 * Thrown when text cannot be read from a single file.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
