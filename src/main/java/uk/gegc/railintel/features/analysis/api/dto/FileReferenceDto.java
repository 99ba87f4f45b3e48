package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "FileReferenceDto", description = "A stored file to extract text from")
public record FileReferenceDto(
        @Schema(description = "Server-side path of the stored file", example = "/var/uploads/3f2a_safety_manual.pdf")
        @NotBlank(message = "File path must not be blank")
        @JsonProperty("path")
        String path,

        @Schema(description = "Name the file was uploaded with", example = "safety_manual.pdf")
        @JsonProperty("original_name")
        String originalName
) {
}
