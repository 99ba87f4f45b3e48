package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.shared.util.TextExcerpts;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic analyzer used when no model is available. Each chunk contributes a leading
 * excerpt; the document summary adds counts of structural markers found across all chunks.
 * Never calls out and never throws for well-formed input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuleBasedDocumentAnalyzer implements DocumentAnalyzer {

    private static final Pattern LIST_ITEM = Pattern.compile("(?m)^\\s*(?:[-*•]|\\d+[.)]|[a-z][.)])\\s+\\S");
    private static final int MAX_LISTED_HEADINGS = 8;

    private final AnalysisProperties properties;
    private final KeyInformationExtractor keyInformationExtractor;

    @Override
    public ProcessingMode mode() {
        return ProcessingMode.FALLBACK;
    }

    @Override
    public ChunkResult analyzeChunk(Chunk chunk, int totalChunks) {
        String excerpt = TextExcerpts.excerpt(chunk.text(), properties.getFallbackExcerptChars());
        String partial = totalChunks > 1
                ? "Section " + (chunk.index() + 1) + ": " + excerpt
                : excerpt;
        return ChunkResult.success(chunk, partial, Map.of(), Map.of(), null);
    }

    @Override
    public String synthesize(List<ChunkResult> results) {
        Set<String> headings = new LinkedHashSet<>();
        int dates = 0;
        int listItems = 0;
        int characters = 0;
        for (ChunkResult result : results) {
            String text = result.chunk().text();
            characters += text.length();
            headings.addAll(keyInformationExtractor.extractHeadings(text));
            dates += keyInformationExtractor.extractDates(text).size();
            listItems += (int) LIST_ITEM.matcher(text).results().count();
        }

        StringBuilder summary = new StringBuilder();
        summary.append("Document overview: ")
                .append(characters).append(" characters in ")
                .append(results.size()).append(results.size() == 1 ? " section" : " sections")
                .append("; ").append(headings.size()).append(" heading(s), ")
                .append(dates).append(" date reference(s) and ")
                .append(listItems).append(" list item(s) detected.");
        if (!headings.isEmpty()) {
            List<String> listed = new ArrayList<>(headings).subList(0, Math.min(MAX_LISTED_HEADINGS, headings.size()));
            summary.append("\nHeadings: ").append(String.join("; ", listed));
        }
        summary.append("\n\n");
        for (ChunkResult result : results) {
            summary.append(result.partialSummary()).append('\n');
        }

        log.debug("Built rule-based summary over {} chunk(s)", results.size());
        return TextExcerpts.truncateAtSentence(summary.toString(), properties.getSynthesisMaxChars());
    }
}
