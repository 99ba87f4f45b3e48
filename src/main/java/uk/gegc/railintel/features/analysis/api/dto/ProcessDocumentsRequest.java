package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "ProcessDocumentsRequest", description = "Files to analyse as one document")
public record ProcessDocumentsRequest(
        @Schema(description = "Files in reading order")
        @NotEmpty(message = "At least one file is required")
        @JsonProperty("files")
        List<@Valid FileReferenceDto> files,

        @Schema(description = "OCR language hint", example = "eng+mal", defaultValue = "eng+mal")
        @JsonProperty("ocr_language")
        String ocrLanguage,

        @Schema(description = "Classification mode", allowableValues = {"railway", "general", "both"}, defaultValue = "railway")
        @JsonProperty("classification_mode")
        String classificationMode
) {
}
