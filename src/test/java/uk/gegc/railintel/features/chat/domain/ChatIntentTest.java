package uk.gegc.railintel.features.chat.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChatIntent Tests")
class ChatIntentTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "What dates are mentioned?, DATE",
            "When is the deadline?, DATE",
            "Are there any safety hazards?, SAFETY_COMPLIANCE",
            "Which regulations apply?, SAFETY_COMPLIANCE",
            "What type of document is this?, DOCUMENT_TYPE",
            "Give me a summary, SUMMARY",
            "What are the main points?, SUMMARY"
    })
    @DisplayName("Detects the intent with the most trigger words")
    void detectsIntent(String message, ChatIntent expected) {
        assertThat(ChatIntent.detect(message)).contains(expected);
    }

    @Test
    @DisplayName("Ties go to the intent declared first")
    void tiesGoToFirstDeclared() {
        assertThat(ChatIntent.detect("Is the schedule safe?")).contains(ChatIntent.DATE);
        assertThat(ChatIntent.detect("A summary of safety please")).contains(ChatIntent.SAFETY_COMPLIANCE);
    }

    @Test
    @DisplayName("Messages without triggers have no intent")
    void noIntent() {
        assertThat(ChatIntent.detect("Hello there")).isEmpty();
        assertThat(ChatIntent.detect("  ")).isEmpty();
        assertThat(ChatIntent.detect(null)).isEmpty();
    }
}
