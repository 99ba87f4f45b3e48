package uk.gegc.railintel.features.analysis.application;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Structured records for the model's per-chunk analysis output.
 */
public class ChunkAnalysisRecords {

    /**
     * One chunk's analysis as returned by the model.
     *
     * @param categories     category key to evidence in [0,1], e.g. {@code safety_manual}
     * @param keyInformation category name to items, e.g. {@code dates}
     */
    public record ChunkAnalysisResponse(
            @JsonProperty("summary") String summary,
            @JsonProperty("document_type") String documentType,
            @JsonProperty("categories") Map<String, Double> categories,
            @JsonProperty("key_information") Map<String, List<String>> keyInformation
    ) {}
}
