package uk.gegc.railintel.features.analysis.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClassificationInsights Tests")
class ClassificationInsightsTest {

    @Test
    @DisplayName("Describes the top entry and counts confident ones")
    void describesTopEntry() {
        List<ClassificationEntry> entries = List.of(
                new ClassificationEntry(DocumentCategory.SAFETY_MANUAL, 0.92, 0.71),
                new ClassificationEntry(DocumentCategory.INFRASTRUCTURE, 0.7, 0.71),
                new ClassificationEntry(DocumentCategory.ROLLING_STOCK, 0.4, 0.71));

        ClassificationInsights insights = ClassificationInsights.from(entries);

        assertThat(insights.primaryCategory()).isEqualTo("Safety Manual");
        assertThat(insights.primaryConfidence()).isEqualTo(0.92);
        assertThat(insights.confidenceLevel()).isEqualTo(ConfidenceLevel.VERY_HIGH);
        assertThat(insights.highConfidenceCount()).isEqualTo(2);
        assertThat(insights.operatorDocument()).isTrue();
        assertThat(insights.categoryCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("No entries means no insights")
    void emptyClassification() {
        assertThat(ClassificationInsights.from(List.of())).isNull();
        assertThat(ClassificationInsights.from(null)).isNull();
    }

    @Test
    @DisplayName("Confidence levels follow their lower bounds")
    void confidenceLevels() {
        assertThat(ConfidenceLevel.of(0.9)).isEqualTo(ConfidenceLevel.VERY_HIGH);
        assertThat(ConfidenceLevel.of(0.75)).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(ConfidenceLevel.of(0.5)).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(ConfidenceLevel.of(0.3)).isEqualTo(ConfidenceLevel.LOW);
        assertThat(ConfidenceLevel.of(0.1)).isEqualTo(ConfidenceLevel.VERY_LOW);
    }

    @Test
    @DisplayName("Entries outside [0,1] are rejected")
    void entryBounds() {
        assertThatThrownBy(() -> new ClassificationEntry(DocumentCategory.SAFETY_MANUAL, 1.2, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
