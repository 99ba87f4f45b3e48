package uk.gegc.railintel.features.analysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "railintel.classification")
@Data
public class ClassificationProperties {

    /**
     * Categories scoring below this are left out of the result.
     */
    private double minConfidence = 0.1;

    private int maxResults = 5;

    /**
     * Relevance above which confidences are boosted for operator-specific documents.
     */
    private double operatorBoostThreshold = 0.3;

    /**
     * Terms identifying documents of the operating company (Kochi Metro Rail by default).
     */
    private List<String> operatorKeywords = new ArrayList<>(List.of(
            "kmrl", "kochi metro", "kerala", "metro rail", "rapid transit",
            "kochi", "ernakulam", "aluva", "maharajas college", "palarivattom",
            "edappally", "kalamassery", "cochin", "metro station"));
}
