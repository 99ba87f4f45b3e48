package uk.gegc.railintel.features.analysis.domain.model;

import java.util.List;

/**
 * What the aggregator produced for a document: the summary and the per-chunk results in chunk order.
 *
 * @param failedChunks indexes of chunks the model could not analyse, kept even when the results
 *                     were replaced by rule-based ones
 */
public record SummaryOutcome(
        String summary,
        List<ChunkResult> chunkResults,
        ProcessingMode mode,
        boolean cancelled,
        List<Integer> failedChunks
) {
    public SummaryOutcome {
        summary = summary == null ? "" : summary;
        chunkResults = chunkResults == null ? List.of() : List.copyOf(chunkResults);
        failedChunks = failedChunks == null ? failedIndexes(chunkResults) : List.copyOf(failedChunks);
    }

    public SummaryOutcome(String summary, List<ChunkResult> chunkResults, ProcessingMode mode, boolean cancelled) {
        this(summary, chunkResults, mode, cancelled, null);
    }

    public List<ChunkResult> successfulResults() {
        return chunkResults.stream().filter(ChunkResult::success).toList();
    }

    public List<Integer> failedChunkIndexes() {
        return failedChunks;
    }

    private static List<Integer> failedIndexes(List<ChunkResult> results) {
        return results.stream()
                .filter(result -> !result.success())
                .map(ChunkResult::chunkIndex)
                .toList();
    }
}
