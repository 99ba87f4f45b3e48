package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.ai.application.PromptTemplateService;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.shared.util.TextExcerpts;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Model-backed analyzer: one structured call per chunk and one synthesis call per document.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiDocumentAnalyzer implements DocumentAnalyzer {

    static final String CHUNK_SYSTEM_TEMPLATE = "chunk-analysis-system.txt";
    static final String CHUNK_TEMPLATE = "chunk-analysis.txt";
    static final String SYNTHESIS_SYSTEM_TEMPLATE = "summary-synthesis-system.txt";
    static final String SYNTHESIS_TEMPLATE = "summary-synthesis.txt";

    private static final int CHARS_PER_WORD = 6;

    private final LlmClient llmClient;
    private final PromptTemplateService promptTemplateService;
    private final AnalysisProperties properties;

    private final BeanOutputConverter<ChunkAnalysisRecords.ChunkAnalysisResponse> outputConverter =
            new BeanOutputConverter<>(ChunkAnalysisRecords.ChunkAnalysisResponse.class);

    @Override
    public ProcessingMode mode() {
        return ProcessingMode.AI;
    }

    @Override
    public ChunkResult analyzeChunk(Chunk chunk, int totalChunks) {
        log.info("Analysing chunk {} of {} ({} chars, ~{} tokens)",
                chunk.index() + 1, totalChunks, chunk.length(), chunk.estimatedTokens());

        String prompt = promptTemplateService.render(CHUNK_TEMPLATE, Map.of(
                "section", String.valueOf(chunk.index() + 1),
                "total", String.valueOf(totalChunks),
                "categories", categoryKeys(),
                "content", chunk.text()
        )) + "\n\n" + outputConverter.getFormat();
        String context = promptTemplateService.loadTemplate(CHUNK_SYSTEM_TEMPLATE);

        String raw = llmClient.call(prompt, context);
        return toChunkResult(chunk, raw);
    }

    @Override
    public String synthesize(List<ChunkResult> results) {
        StringBuilder sections = new StringBuilder();
        for (ChunkResult result : results) {
            sections.append("Section ").append(result.chunkIndex() + 1).append(": ")
                    .append(result.partialSummary().trim()).append("\n\n");
        }
        int maxChars = properties.getSynthesisMaxChars();
        String prompt = promptTemplateService.render(SYNTHESIS_TEMPLATE, Map.of(
                "sectionCount", String.valueOf(results.size()),
                "maxWords", String.valueOf(Math.max(50, maxChars / CHARS_PER_WORD)),
                "sections", sections.toString().trim()
        ));
        String context = promptTemplateService.loadTemplate(SYNTHESIS_SYSTEM_TEMPLATE);

        log.info("Synthesising document summary from {} section summaries", results.size());
        String summary = llmClient.call(prompt, context);
        return TextExcerpts.truncateAtSentence(summary, maxChars);
    }

    ChunkResult toChunkResult(Chunk chunk, String raw) {
        try {
            ChunkAnalysisRecords.ChunkAnalysisResponse response = outputConverter.convert(raw);
            if (response == null) {
                return ChunkResult.success(chunk, partialOrExcerpt(raw, chunk), Map.of(), Map.of(), null);
            }
            return ChunkResult.success(
                    chunk,
                    partialOrExcerpt(response.summary(), chunk),
                    toEvidence(response.categories()),
                    response.keyInformation(),
                    response.documentType() == null || response.documentType().isBlank()
                            ? null : response.documentType().trim()
            );
        } catch (RuntimeException e) {
            log.warn("Chunk {} response could not be mapped; keeping it as plain summary: {}",
                    chunk.index(), e.getMessage());
            return ChunkResult.success(chunk, partialOrExcerpt(raw, chunk), Map.of(), Map.of(), null);
        }
    }

    private Map<DocumentCategory, Double> toEvidence(Map<String, Double> categories) {
        Map<DocumentCategory, Double> evidence = new EnumMap<>(DocumentCategory.class);
        if (categories == null) {
            return evidence;
        }
        categories.forEach((key, score) -> {
            if (score == null || score.isNaN()) {
                return;
            }
            DocumentCategory.fromKey(key)
                    .filter(DocumentCategory::isScored)
                    .ifPresentOrElse(
                            category -> evidence.merge(category, clamp(score), Math::max),
                            () -> log.debug("Ignoring unknown category from model: {}", key));
        });
        return evidence;
    }

    private String partialOrExcerpt(String summary, Chunk chunk) {
        if (summary != null && !summary.isBlank()) {
            return summary.trim();
        }
        return TextExcerpts.excerpt(chunk.text(), properties.getFallbackExcerptChars());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String categoryKeys() {
        return Arrays.stream(DocumentCategory.values())
                .filter(DocumentCategory::isScored)
                .map(category -> category.getKey() + " (" + category.getLabel() + ")")
                .collect(Collectors.joining(", "));
    }
}
