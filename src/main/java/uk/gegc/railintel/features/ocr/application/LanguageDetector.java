package uk.gegc.railintel.features.ocr.application;

import org.springframework.stereotype.Component;

/**
 * Tags text by writing system. Malayalam script wins when it makes up a fifth of the letters.
 */
@Component
public class LanguageDetector {

    public static final String MALAYALAM = "mal";
    public static final String ENGLISH = "eng";
    public static final String UNKNOWN = "unknown";

    private static final double MALAYALAM_SHARE = 0.2;

    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        int malayalam = 0;
        int latin = 0;
        int letters = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            letters++;
            Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
            if (script == Character.UnicodeScript.MALAYALAM) {
                malayalam++;
            } else if (script == Character.UnicodeScript.LATIN) {
                latin++;
            }
        }
        if (letters == 0) {
            return UNKNOWN;
        }
        if (malayalam > 0 && malayalam >= letters * MALAYALAM_SHARE) {
            return MALAYALAM;
        }
        return latin > 0 ? ENGLISH : UNKNOWN;
    }
}
