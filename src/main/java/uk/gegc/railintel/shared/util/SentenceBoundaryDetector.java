package uk.gegc.railintel.shared.util;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates natural split points in text: paragraph breaks, sentence endings and word boundaries.
 * All positions are absolute offsets into the text; a returned split point {@code p} means the
 * left part is {@code text.substring(from, p)}.
 */
@Component
public class SentenceBoundaryDetector {

    // Blank line(s): newline, optional horizontal whitespace, newline, plus any trailing whitespace
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\r\\f]*\\n\\s*");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "inc", "ltd", "corp", "co", "vs", "etc",
            "no", "st", "fig", "approx", "dept", "e.g", "i.e", "a.m", "p.m", "u.s", "u.k", "ph.d");

    /**
     * @return the offset just after the last paragraph break in {@code (from, to]}, or -1
     */
    public int findLastParagraphBreak(String text, int from, int to) {
        if (text == null || from >= to) {
            return -1;
        }
        Matcher matcher = PARAGRAPH_BREAK.matcher(text);
        matcher.region(from, Math.min(to, text.length()));
        int last = -1;
        while (matcher.find()) {
            if (matcher.end() > from) {
                last = matcher.end();
            }
        }
        return last;
    }

    /**
     * @return the offset after the last sentence ending (and its trailing whitespace) in
     * {@code (from, to]}, or -1
     */
    public int findLastSentenceEnd(String text, int from, int to) {
        if (text == null || from >= to) {
            return -1;
        }
        int limit = Math.min(to, text.length());
        for (int i = limit - 1; i >= from; i--) {
            if (isSentenceEnding(text, i)) {
                int split = i + 1;
                while (split < limit && Character.isWhitespace(text.charAt(split))) {
                    split++;
                }
                return split > from ? split : -1;
            }
        }
        return -1;
    }

    /**
     * @return the offset just after the last whitespace character in {@code (from, to]}, or -1
     */
    public int findLastWordBoundary(String text, int from, int to) {
        if (text == null || from >= to) {
            return -1;
        }
        for (int i = Math.min(to, text.length()); i > from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    private boolean isSentenceEnding(String text, int position) {
        char c = text.charAt(position);
        if (c != '.' && c != '!' && c != '?') {
            return false;
        }
        if (position < text.length() - 1 && !Character.isWhitespace(text.charAt(position + 1))) {
            return false;
        }
        if (c == '.') {
            return !isEllipsis(text, position) && !isAbbreviation(text, position);
        }
        return true;
    }

    private boolean isEllipsis(String text, int position) {
        return position > 0 && text.charAt(position - 1) == '.';
    }

    private boolean isAbbreviation(String text, int position) {
        int start = position;
        while (start > 0 && !Character.isWhitespace(text.charAt(start - 1))) {
            start--;
        }
        if (start == position) {
            return false;
        }
        String word = text.substring(start, position).toLowerCase(Locale.ROOT);
        if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
            // Initials such as "J. Smith"
            return true;
        }
        return ABBREVIATIONS.contains(word);
    }
}
