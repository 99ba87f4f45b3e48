package uk.gegc.railintel.features.chat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "ChatResponseDto", description = "Answer to a chat question")
public record ChatResponseDto(
        @Schema(description = "Answer text, never empty")
        @JsonProperty("response")
        String response,

        @Schema(description = "False when the answer came from the rule-based responder")
        @JsonProperty("ai_generated")
        boolean aiGenerated,

        @JsonProperty("timestamp")
        LocalDateTime timestamp
) {
}
