package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ClassificationDto", description = "One category with its confidence")
public record ClassificationDto(
        @Schema(description = "Category label", example = "Safety Manual")
        @JsonProperty("category")
        String category,

        @Schema(description = "Stable category key", example = "safety_manual")
        @JsonProperty("category_key")
        String categoryKey,

        @Schema(description = "Confidence in [0,1], two decimals", example = "0.82")
        @JsonProperty("confidence")
        double confidence,

        @Schema(description = "How strongly the document refers to the operator, in [0,1]", example = "0.29")
        @JsonProperty("operator_relevance")
        double operatorRelevance
) {
}
