package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "MetadataDto", description = "How the document was processed")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetadataDto(
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("files_processed") int filesProcessed,
        @JsonProperty("languages_detected") List<String> languagesDetected,
        @JsonProperty("ocr_language") String ocrLanguage,
        @JsonProperty("classification_mode") String classificationMode,
        @JsonProperty("total_characters") int totalCharacters,

        @Schema(description = "ai, ai_partial or fallback", example = "ai")
        @JsonProperty("processing_mode") String processingMode,

        @Schema(description = "True when any part of the result was produced without the model")
        @JsonProperty("degraded") boolean degraded,

        @JsonProperty("chunk_count") int chunkCount,
        @JsonProperty("failed_chunks") List<Integer> failedChunks,
        @JsonProperty("cancelled") boolean cancelled,

        @Schema(description = "Human-readable note explaining a degraded result")
        @JsonProperty("notice") String notice,

        @JsonProperty("processing_time_ms") long processingTimeMs
) {
}
