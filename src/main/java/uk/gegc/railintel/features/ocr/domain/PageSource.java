package uk.gegc.railintel.features.ocr.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads the pages of one file format. Strategy selected by file name.
 */
public interface PageSource {

    /**
     * @param fileName original file name, used for extension checks
     */
    boolean supports(String fileName);

    /**
     * @return page texts in order; may be empty for a file without text
     * @throws ExtractionException if the file cannot be read or parsed
     */
    List<String> readPages(Path file) throws ExtractionException;
}
