package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DownloadResponse", description = "Text content prepared for saving as a file")
public record DownloadResponse(
        @JsonProperty("content") String content,
        @Schema(example = "ai_summary.txt") @JsonProperty("filename") String filename,
        @Schema(example = "text/plain") @JsonProperty("content_type") String contentType
) {
}
