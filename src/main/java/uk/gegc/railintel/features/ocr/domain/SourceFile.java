package uk.gegc.railintel.features.ocr.domain;

import java.nio.file.Path;

/**
 * A file handed over for text extraction: where it is and what the user called it.
 */
public record SourceFile(Path path, String originalName) {

    public String displayName() {
        if (originalName != null && !originalName.isBlank()) {
            return originalName;
        }
        Path fileName = path == null ? null : path.getFileName();
        return fileName == null ? "document" : fileName.toString();
    }
}
