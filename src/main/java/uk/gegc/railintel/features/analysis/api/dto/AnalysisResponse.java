package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Wire form of an analysis. Clients post it back unchanged to the chat and download endpoints.
 */
@Schema(name = "AnalysisResponse", description = "Summary, classification and extracted text of a processed document")
public record AnalysisResponse(
        @Schema(description = "Detected document type", example = "Safety Manual")
        @JsonProperty("document_type")
        String documentType,

        @Schema(description = "Categories by descending confidence")
        @JsonProperty("classification")
        List<ClassificationDto> classification,

        @JsonProperty("classification_insights")
        InsightsDto classificationInsights,

        @JsonProperty("ocr_text")
        String ocrText,

        @JsonProperty("summary")
        String summary,

        @Schema(description = "Category to extracted items, e.g. dates or safety_notes")
        @JsonProperty("key_information")
        Map<String, List<String>> keyInformation,

        @JsonProperty("metadata")
        MetadataDto metadata
) {
}
