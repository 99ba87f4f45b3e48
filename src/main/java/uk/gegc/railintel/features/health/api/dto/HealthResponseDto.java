package uk.gegc.railintel.features.health.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "HealthResponseDto", description = "Service status")
public record HealthResponseDto(
        @Schema(example = "healthy") @JsonProperty("status") String status,
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @Schema(description = "ai when model credentials are configured, otherwise fallback", example = "ai")
        @JsonProperty("ai_mode") String aiMode
) {
}
