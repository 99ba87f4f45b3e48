package uk.gegc.railintel.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SentenceBoundaryDetector Tests")
class SentenceBoundaryDetectorTest {

    private final SentenceBoundaryDetector detector = new SentenceBoundaryDetector();

    @Test
    @DisplayName("Paragraph break includes the blank line and following indentation")
    void paragraphBreakIncludesBlankLine() {
        String text = "First paragraph.\n  \n   Second paragraph.";

        int split = detector.findLastParagraphBreak(text, 0, text.length());

        assertThat(text.substring(split)).isEqualTo("Second paragraph.");
    }

    @Test
    @DisplayName("Returns the last paragraph break inside the window")
    void returnsLastParagraphBreakInWindow() {
        String text = "One.\n\nTwo.\n\nThree.\n\nFour.";

        int split = detector.findLastParagraphBreak(text, 0, 18);

        assertThat(text.substring(0, split)).isEqualTo("One.\n\nTwo.\n\n");
    }

    @Test
    @DisplayName("Sentence end skips abbreviations, initials and ellipses")
    void sentenceEndSkipsAbbreviations() {
        assertThat(detector.findLastSentenceEnd("Ask Dr. Nair now", 0, 16)).isEqualTo(-1);
        assertThat(detector.findLastSentenceEnd("Signed by K. Das today", 0, 22)).isEqualTo(-1);
        assertThat(detector.findLastSentenceEnd("Wait... then go", 0, 15)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Sentence end includes trailing whitespace")
    void sentenceEndIncludesTrailingWhitespace() {
        String text = "Trains stop here.   Next part";

        int split = detector.findLastSentenceEnd(text, 0, text.length());

        assertThat(text.substring(split)).isEqualTo("Next part");
    }

    @Test
    @DisplayName("Question and exclamation marks end sentences")
    void questionAndExclamationEndSentences() {
        String text = "Is the line clear? Yes! Proceed";

        int split = detector.findLastSentenceEnd(text, 0, text.length());

        assertThat(text.substring(split)).isEqualTo("Proceed");
    }

    @Test
    @DisplayName("Word boundary is found after whitespace; none in a single token")
    void wordBoundary() {
        assertThat(detector.findLastWordBoundary("alpha beta gamma", 0, 12)).isEqualTo(11);
        assertThat(detector.findLastWordBoundary("unbroken", 0, 8)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Empty windows have no boundaries")
    void emptyWindowsHaveNoBoundaries() {
        assertThat(detector.findLastParagraphBreak("a\n\nb", 2, 2)).isEqualTo(-1);
        assertThat(detector.findLastSentenceEnd(null, 0, 5)).isEqualTo(-1);
    }
}
