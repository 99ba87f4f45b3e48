package uk.gegc.railintel.features.analysis.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of analysing one chunk. Failed results carry the reason and no content.
 */
public record ChunkResult(
        Chunk chunk,
        String partialSummary,
        Map<DocumentCategory, Double> categoryEvidence,
        Map<String, List<String>> keyInformation,
        String documentTypeGuess,
        boolean success,
        String failureReason
) {
    public ChunkResult {
        categoryEvidence = categoryEvidence == null || categoryEvidence.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(categoryEvidence));
        keyInformation = KeyInformationMaps.copyOf(keyInformation);
    }

    public static ChunkResult success(Chunk chunk,
                                      String partialSummary,
                                      Map<DocumentCategory, Double> categoryEvidence,
                                      Map<String, List<String>> keyInformation,
                                      String documentTypeGuess) {
        return new ChunkResult(chunk, partialSummary == null ? "" : partialSummary,
                categoryEvidence, keyInformation, documentTypeGuess, true, null);
    }

    public static ChunkResult failure(Chunk chunk, String reason) {
        return new ChunkResult(chunk, "", Map.of(), Map.of(), null, false, reason);
    }

    public int chunkIndex() {
        return chunk.index();
    }
}
