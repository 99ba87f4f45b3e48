package uk.gegc.railintel.features.chat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "ChatTurnDto", description = "An earlier message in the conversation")
public record ChatTurnDto(
        @Schema(description = "Who sent the message", allowableValues = {"user", "assistant"})
        @JsonProperty("role")
        String role,

        @Schema(description = "Message text", maxLength = 10000)
        @Size(max = 10000, message = "History messages must not exceed 10000 characters")
        @JsonProperty("content")
        String content
) {
}
