package uk.gegc.railintel.features.analysis.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "InsightsDto", description = "Summary view over the classification")
public record InsightsDto(
        @JsonProperty("primary_category") String primaryCategory,
        @JsonProperty("primary_confidence") double primaryConfidence,
        @Schema(example = "High") @JsonProperty("confidence_level") String confidenceLevel,
        @JsonProperty("high_confidence_count") int highConfidenceCount,
        @JsonProperty("operator_relevance") double operatorRelevance,
        @JsonProperty("is_operator_document") boolean operatorDocument,
        @JsonProperty("category_count") int categoryCount
) {
}
