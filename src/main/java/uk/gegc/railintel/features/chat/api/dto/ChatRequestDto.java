package uk.gegc.railintel.features.chat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.railintel.features.analysis.api.dto.AnalysisResponse;

import java.util.List;

@Schema(name = "ChatRequestDto", description = "A question about a processed document")
public record ChatRequestDto(
        @Schema(description = "The question", example = "What dates are mentioned?")
        @NotBlank(message = "Message cannot be blank")
        @Size(max = 2000, message = "Message must not exceed 2000 characters")
        @JsonProperty("message")
        String message,

        @Schema(description = "Analysis returned by /api/process; may be omitted before any document is processed")
        @JsonProperty("processed_data")
        AnalysisResponse processedData,

        @Schema(description = "Earlier turns, oldest first")
        @JsonProperty("history")
        List<@Valid ChatTurnDto> history
) {
}
