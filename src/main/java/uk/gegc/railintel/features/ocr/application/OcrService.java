package uk.gegc.railintel.features.ocr.application;

import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.OcrExtraction;
import uk.gegc.railintel.features.ocr.domain.SourceFile;

/**
 * Producer of raw page text for the analysis pipeline.
 */
public interface OcrService {

    /**
     * @param languageHint requested OCR language(s), e.g. {@code eng+mal}; implementations may ignore it
     * @return pages numbered from 1 within the file
     * @throws ExtractionException if the file is missing, unsupported or unreadable
     */
    OcrExtraction extract(SourceFile file, String languageHint) throws ExtractionException;
}
