package uk.gegc.railintel.features.analysis.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.analysis.application.AnalyzerSelector;
import uk.gegc.railintel.features.analysis.application.DocumentAnalysisService;
import uk.gegc.railintel.features.analysis.application.DocumentAnalyzer;
import uk.gegc.railintel.features.analysis.application.DocumentClassifier;
import uk.gegc.railintel.features.analysis.application.KeyInformationExtractor;
import uk.gegc.railintel.features.analysis.application.SummaryAggregator;
import uk.gegc.railintel.features.analysis.application.TextChunker;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisMetadata;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationInsights;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationMode;
import uk.gegc.railintel.features.analysis.domain.model.Document;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.features.analysis.domain.model.SummaryOutcome;
import uk.gegc.railintel.features.ocr.application.OcrService;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.OcrExtraction;
import uk.gegc.railintel.features.ocr.domain.OcrPage;
import uk.gegc.railintel.features.ocr.domain.SourceFile;
import uk.gegc.railintel.shared.exception.ChunkingException;
import uk.gegc.railintel.shared.exception.DocumentProcessingException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentAnalysisServiceImpl implements DocumentAnalysisService {

    static final String EMPTY_SUMMARY = "No analyzable text was extracted from the document.";
    static final String UNKNOWN_DOCUMENT = "Unknown Document";
    static final String GENERAL_DOCUMENT = "General Document";
    static final String DOCUMENT_SEPARATOR = "\n\n--- Document: %s ---\n\n";

    private final OcrService ocrService;
    private final TextChunker textChunker;
    private final AnalyzerSelector analyzerSelector;
    private final SummaryAggregator summaryAggregator;
    private final DocumentClassifier documentClassifier;
    private final KeyInformationExtractor keyInformationExtractor;
    private final AnalysisProperties analysisProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public AnalysisResult process(List<SourceFile> files, String ocrLanguage, ClassificationMode classificationMode) {
        if (files == null || files.isEmpty()) {
            throw new DocumentProcessingException("No files provided");
        }

        StringBuilder combined = new StringBuilder();
        Set<String> languages = new LinkedHashSet<>();
        int pageCount = 0;
        int filesProcessed = 0;

        for (SourceFile file : files) {
            OcrExtraction extraction;
            try {
                extraction = ocrService.extract(file, ocrLanguage);
            } catch (ExtractionException e) {
                log.warn("Skipping {}: {}", file.displayName(), e.getMessage());
                continue;
            }
            if (extraction.isEmpty()) {
                log.warn("Skipping {}: no text found", file.displayName());
                continue;
            }
            for (OcrPage page : extraction.pages()) {
                pageCount++;
                languages.add(page.language());
            }
            combined.append(String.format(DOCUMENT_SEPARATOR, extraction.fileName())).append(extraction.text());
            filesProcessed++;
        }

        if (pageCount == 0) {
            throw new DocumentProcessingException("Failed to extract text from any of the " + files.size() + " file(s)");
        }
        log.info("Extracted {} page(s) from {} of {} file(s); languages {}",
                pageCount, filesProcessed, files.size(), languages);

        return analyze(new Document(combined.toString(), languages, pageCount),
                filesProcessed, ocrLanguage, classificationMode);
    }

    @Override
    public AnalysisResult analyze(Document document, int filesProcessed, String ocrLanguage,
                                  ClassificationMode classificationMode) {
        Instant started = clock.instant();
        ClassificationMode mode = classificationMode == null ? ClassificationMode.RAILWAY : classificationMode;
        String text = document == null || document.text() == null ? "" : document.text();

        List<Chunk> chunks;
        try {
            chunks = text.isBlank() ? List.of() : textChunker.chunk(text, analysisProperties.getMaxTokensPerChunk());
        } catch (ChunkingException e) {
            log.warn("Could not chunk document: {}", e.getMessage());
            chunks = List.of();
        }

        if (chunks.isEmpty()) {
            log.warn("Document has no analyzable text");
            return emptyResult(document, text, filesProcessed, ocrLanguage, mode, started);
        }

        DocumentAnalyzer analyzer = analyzerSelector.select();
        SummaryOutcome outcome = summaryAggregator.summarize(chunks, analyzer);

        List<ClassificationEntry> classification = mode.includesRailway()
                ? documentClassifier.classify(chunks, outcome.chunkResults())
                : List.of();
        Map<String, List<String>> keyInformation =
                keyInformationExtractor.merge(outcome.chunkResults(), keyInformationExtractor.extract(text));

        AnalysisMetadata metadata = new AnalysisMetadata(
                document.pageCount(),
                filesProcessed,
                sortedLanguages(document),
                ocrLanguage,
                mode,
                text.length(),
                outcome.mode(),
                chunks.size(),
                outcome.failedChunkIndexes(),
                outcome.cancelled(),
                notice(outcome, chunks.size()),
                elapsedMillis(started)
        );

        meterRegistry.counter("railintel.analysis.runs", "mode", outcome.mode().getValue()).increment();
        log.info("Analysed document: {} chars, {} chunk(s), mode={}, {} categor(ies)",
                text.length(), chunks.size(), outcome.mode().getValue(), classification.size());

        return new AnalysisResult(
                documentType(classification, outcome, mode),
                outcome.summary(),
                text,
                classification,
                keyInformation,
                ClassificationInsights.from(classification),
                metadata
        );
    }

    private AnalysisResult emptyResult(Document document, String text, int filesProcessed, String ocrLanguage,
                                       ClassificationMode mode, Instant started) {
        meterRegistry.counter("railintel.analysis.runs", "mode", ProcessingMode.FALLBACK.getValue()).increment();
        AnalysisMetadata metadata = new AnalysisMetadata(
                document == null ? 0 : document.pageCount(),
                filesProcessed,
                sortedLanguages(document),
                ocrLanguage,
                mode,
                text.length(),
                ProcessingMode.FALLBACK,
                0,
                List.of(),
                false,
                "The document contained no text to analyse.",
                elapsedMillis(started)
        );
        return new AnalysisResult(UNKNOWN_DOCUMENT, EMPTY_SUMMARY, text, List.of(), Map.of(), null, metadata);
    }

    /**
     * Model guess first, then the top category, then a generic label.
     */
    private String documentType(List<ClassificationEntry> classification, SummaryOutcome outcome,
                                ClassificationMode mode) {
        for (ChunkResult result : outcome.successfulResults()) {
            if (result.documentTypeGuess() != null && !result.documentTypeGuess().isBlank()) {
                return result.documentTypeGuess();
            }
        }
        if (!classification.isEmpty()) {
            return classification.get(0).label();
        }
        return mode.includesRailway() ? UNKNOWN_DOCUMENT : GENERAL_DOCUMENT;
    }

    private String notice(SummaryOutcome outcome, int chunkCount) {
        List<String> parts = new ArrayList<>();
        List<Integer> failed = outcome.failedChunkIndexes();
        if (outcome.mode() == ProcessingMode.FALLBACK && !failed.isEmpty()) {
            parts.add(String.format("AI analysis failed for %d of %d section(s); the summary and classification "
                    + "were produced by rule-based analysis.", failed.size(), chunkCount));
        } else if (outcome.mode() == ProcessingMode.FALLBACK) {
            parts.add("AI analysis was unavailable; the summary and classification were produced by rule-based analysis.");
        }
        if (outcome.mode() != ProcessingMode.FALLBACK && !failed.isEmpty()) {
            parts.add(String.format("%d of %d section(s) could not be analysed (%s); results are based on the remaining sections.",
                    failed.size(), chunkCount,
                    failed.stream().map(index -> "section " + (index + 1)).collect(Collectors.joining(", "))));
        }
        if (outcome.cancelled()) {
            parts.add("Processing stopped early; sections after the last one reached were not sent to the AI.");
        }
        if (parts.isEmpty() && outcome.mode() == ProcessingMode.AI_PARTIAL) {
            parts.add("Section summaries could not be merged by the AI; they are shown in order.");
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private List<String> sortedLanguages(Document document) {
        if (document == null || document.languages() == null) {
            return List.of();
        }
        return document.languages().stream().sorted().toList();
    }

    private long elapsedMillis(Instant started) {
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }
}
