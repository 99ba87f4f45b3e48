package uk.gegc.railintel.features.ocr.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.ocr.application.LanguageDetector;
import uk.gegc.railintel.features.ocr.application.OcrService;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.OcrExtraction;
import uk.gegc.railintel.features.ocr.domain.OcrPage;
import uk.gegc.railintel.features.ocr.domain.PageSource;
import uk.gegc.railintel.features.ocr.domain.SourceFile;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads already-digitised files through the matching {@link PageSource} and tags each page's
 * language. No image OCR is performed here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageSourceOcrService implements OcrService {

    private final List<PageSource> pageSources;
    private final LanguageDetector languageDetector;

    @Override
    public OcrExtraction extract(SourceFile file, String languageHint) throws ExtractionException {
        if (file == null || file.path() == null) {
            throw new ExtractionException("No file path given");
        }
        String name = file.displayName();
        if (!Files.isRegularFile(file.path())) {
            throw new ExtractionException("File not found: " + name);
        }

        PageSource source = findSource(name);
        if (source == null) {
            source = findSource(file.path().getFileName().toString());
        }
        if (source == null) {
            throw new ExtractionException("Unsupported file format: " + name);
        }

        log.debug("Extracting {} with {} (language hint {})", name, source.getClass().getSimpleName(), languageHint);
        List<String> texts = source.readPages(file.path());
        List<OcrPage> pages = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            pages.add(new OcrPage(i + 1, texts.get(i), languageDetector.detect(texts.get(i))));
        }
        return new OcrExtraction(name, pages);
    }

    private PageSource findSource(String fileName) {
        return pageSources.stream()
                .filter(source -> source.supports(fileName))
                .findFirst()
                .orElse(null);
    }
}
