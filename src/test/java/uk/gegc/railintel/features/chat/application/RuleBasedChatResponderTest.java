package uk.gegc.railintel.features.chat.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;
import uk.gegc.railintel.features.chat.config.ChatProperties;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleBasedChatResponder Tests")
class RuleBasedChatResponderTest {

    private RuleBasedChatResponder responder;
    private AnalysisResult analysis;

    @BeforeEach
    void setUp() {
        responder = new RuleBasedChatResponder(new ChatProperties());
        analysis = new AnalysisResult(
                "Safety Manual",
                "Platform safety rules for station staff.",
                "ocr text",
                List.of(new ClassificationEntry(DocumentCategory.SAFETY_MANUAL, 0.92, 0.0),
                        new ClassificationEntry(DocumentCategory.INFRASTRUCTURE, 0.4, 0.0)),
                Map.of("dates", List.of("12 March 2024"),
                        "safety_notes", List.of("Wear helmets near the track.")),
                null,
                null);
    }

    @Test
    @DisplayName("Lists the dates found in the document")
    void answersDates() {
        String response = responder.respond("What dates are mentioned?", analysis);

        assertThat(response)
                .startsWith("The document mentions the following dates:")
                .contains("• 12 March 2024");
    }

    @Test
    @DisplayName("Says so when no dates were found")
    void noDates() {
        AnalysisResult withoutDates = new AnalysisResult("Safety Manual", "s", "", List.of(), Map.of(), null, null);

        assertThat(responder.respond("When is it due?", withoutDates)).contains("could not find any specific dates");
    }

    @Test
    @DisplayName("Describes the document type with top categories")
    void answersDocumentType() {
        String response = responder.respond("What type of document is this?", analysis);

        assertThat(response).isEqualTo("Based on the analysis, this appears to be a **Safety Manual**. "
                + "Top categories: Safety Manual (92%), Infrastructure (40%).");
    }

    @Test
    @DisplayName("Combines safety categories and passages")
    void answersSafety() {
        String response = responder.respond("Are there any safety hazards?", analysis);

        assertThat(response)
                .contains("Safety Manual (92%)")
                .contains("• Wear helmets near the track.")
                .doesNotContain("Infrastructure");
    }

    @Test
    @DisplayName("Returns the stored summary")
    void answersSummary() {
        assertThat(responder.respond("Give me a summary", analysis)).isEqualTo("Platform safety rules for station staff.");
    }

    @Test
    @DisplayName("Unrecognised questions get an honest answer")
    void unrecognisedQuestion() {
        assertThat(responder.respond("Who signed it?", analysis)).isEqualTo(RuleBasedChatResponder.NOT_ENOUGH_INFORMATION);
    }

    @Test
    @DisplayName("Without a processed document the user is told to upload one")
    void noDocument() {
        assertThat(responder.respond("What dates are mentioned?", null))
                .isEqualTo(RuleBasedChatResponder.NO_DOCUMENT_RESPONSE);
    }
}
