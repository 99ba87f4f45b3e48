package uk.gegc.railintel.features.analysis.domain.model;

import java.util.List;

public record AnalysisMetadata(
        int totalPages,
        int filesProcessed,
        List<String> languagesDetected,
        String ocrLanguage,
        ClassificationMode classificationMode,
        int totalCharacters,
        ProcessingMode processingMode,
        int chunkCount,
        List<Integer> failedChunks,
        boolean cancelled,
        String notice,
        long processingTimeMs
) {
    public AnalysisMetadata {
        languagesDetected = languagesDetected == null ? List.of() : List.copyOf(languagesDetected);
        failedChunks = failedChunks == null ? List.of() : List.copyOf(failedChunks);
        processingMode = processingMode == null ? ProcessingMode.FALLBACK : processingMode;
        classificationMode = classificationMode == null ? ClassificationMode.RAILWAY : classificationMode;
    }

    public boolean degraded() {
        return processingMode.isDegraded() || cancelled || !failedChunks.isEmpty();
    }
}
