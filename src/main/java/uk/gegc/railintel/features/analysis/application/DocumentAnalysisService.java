package uk.gegc.railintel.features.analysis.application;

import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationMode;
import uk.gegc.railintel.features.analysis.domain.model.Document;
import uk.gegc.railintel.features.ocr.domain.SourceFile;

import java.util.List;

public interface DocumentAnalysisService {

    /**
     * Extracts text from every readable file and analyses the combined document.
     *
     * @throws uk.gegc.railintel.shared.exception.DocumentProcessingException if no page could be
     *                                                                        extracted from any file
     */
    AnalysisResult process(List<SourceFile> files, String ocrLanguage, ClassificationMode classificationMode);

    /**
     * Analyses already-extracted text. Never fails because of the language model; degraded runs
     * are reported through the result metadata.
     */
    AnalysisResult analyze(Document document, int filesProcessed, String ocrLanguage,
                           ClassificationMode classificationMode);
}
