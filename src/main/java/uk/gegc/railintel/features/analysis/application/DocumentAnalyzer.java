package uk.gegc.railintel.features.analysis.application;

import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;

import java.util.List;

/**
 * Produces per-chunk findings and folds them into one document summary.
 * Implementations throw {@link uk.gegc.railintel.shared.exception.AiServiceException} subtypes
 * when a provider call fails; the caller decides whether to continue.
 */
public interface DocumentAnalyzer {

    ProcessingMode mode();

    ChunkResult analyzeChunk(Chunk chunk, int totalChunks);

    /**
     * @param results successful chunk results in chunk order, never empty
     */
    String synthesize(List<ChunkResult> results);
}
