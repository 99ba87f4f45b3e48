package uk.gegc.railintel.features.ocr.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageDetector Tests")
class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    @DisplayName("Latin text is English")
    void english() {
        assertThat(detector.detect("Platform 2 is closed for maintenance.")).isEqualTo(LanguageDetector.ENGLISH);
    }

    @Test
    @DisplayName("Malayalam script is detected")
    void malayalam() {
        assertThat(detector.detect("സുരക്ഷാ നിർദ്ദേശങ്ങൾ")).isEqualTo(LanguageDetector.MALAYALAM);
    }

    @Test
    @DisplayName("Mixed text is Malayalam when the script is a large enough share")
    void mixed() {
        assertThat(detector.detect("Station സ്റ്റേഷൻ")).isEqualTo(LanguageDetector.MALAYALAM);
        assertThat(detector.detect("A long English sentence about the Kochi metro with one word മെട്രോ"))
                .isEqualTo(LanguageDetector.ENGLISH);
    }

    @Test
    @DisplayName("Text without letters is unknown")
    void unknown() {
        assertThat(detector.detect("12/03/2024 -- 42")).isEqualTo(LanguageDetector.UNKNOWN);
        assertThat(detector.detect(" ")).isEqualTo(LanguageDetector.UNKNOWN);
        assertThat(detector.detect(null)).isEqualTo(LanguageDetector.UNKNOWN);
    }
}
