package uk.gegc.railintel.shared.util;

/**
 * Bounded excerpts of free text. Cuts fall on a sentence end where one is close enough, otherwise on
 * a word boundary, and are marked with an ellipsis.
 */
public final class TextExcerpts {

    public static final String ELLIPSIS = "…";

    private TextExcerpts() {
    }

    /**
     * @return the whitespace-collapsed text, cut back to at most {@code maxChars} characters
     */
    public static String excerpt(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= maxChars) {
            return collapsed;
        }
        if (maxChars <= ELLIPSIS.length()) {
            return collapsed.substring(0, Math.max(0, maxChars));
        }
        int limit = maxChars - ELLIPSIS.length();
        int cut = collapsed.lastIndexOf(' ', limit);
        if (cut < limit / 2) {
            cut = limit;
        }
        return collapsed.substring(0, cut).stripTrailing() + ELLIPSIS;
    }

    /**
     * Like {@link #excerpt(String, int)} but keeps line breaks and prefers ending on a full sentence.
     */
    public static String truncateAtSentence(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        int limit = Math.max(0, maxChars - ELLIPSIS.length());
        int sentenceEnd = -1;
        for (int i = limit - 1; i > limit / 2; i--) {
            char c = trimmed.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(trimmed.charAt(i + 1))) {
                sentenceEnd = i + 1;
                break;
            }
        }
        if (sentenceEnd > 0) {
            return trimmed.substring(0, sentenceEnd);
        }
        int cut = trimmed.lastIndexOf(' ', limit);
        if (cut < limit / 2) {
            cut = limit;
        }
        return trimmed.substring(0, cut).stripTrailing() + ELLIPSIS;
    }
}
