package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.shared.exception.ChunkingException;
import uk.gegc.railintel.shared.util.SentenceBoundaryDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into ordered, non-overlapping chunks that each fit a token budget.
 * <p>
 * Chunks cover the input exactly: concatenating their texts gives back the original. Split points
 * are chosen in this order: paragraph break, sentence end, word boundary, and only then a hard cut.
 * Paragraph and sentence breaks are first looked for in the last three quarters of the window so
 * that a heading near the start does not produce a tiny chunk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

    private static final int MIN_FILL_DIVISOR = 4;

    private final TokenCounter tokenCounter;
    private final SentenceBoundaryDetector boundaryDetector;

    /**
     * @param text              document text, may be empty but not null
     * @param maxTokensPerChunk token budget per chunk, must be positive
     * @return chunks in document order; empty when the text is empty
     * @throws ChunkingException for null text or a non-positive budget
     */
    public List<Chunk> chunk(String text, int maxTokensPerChunk) {
        if (text == null) {
            throw new ChunkingException("Document text cannot be null");
        }
        if (maxTokensPerChunk <= 0) {
            throw new ChunkingException("Token budget per chunk must be positive, got " + maxTokensPerChunk);
        }
        if (text.isEmpty()) {
            log.warn("Received empty text for chunking; document has no analyzable content");
            return List.of();
        }

        int maxChars = tokenCounter.maxCharsForTokens(maxTokensPerChunk);
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = text.length() - start <= maxChars
                    ? text.length()
                    : findSplitPoint(text, start, start + maxChars);
            chunks.add(new Chunk(chunks.size(), text.substring(start, end),
                    tokenCounter.estimateTokens(end - start), start, end));
            start = end;
        }

        log.info("Chunked {} characters into {} chunk(s) (budget {} tokens / {} chars)",
                text.length(), chunks.size(), maxTokensPerChunk, maxChars);
        return chunks;
    }

    private int findSplitPoint(String text, int from, int limit) {
        int minFill = from + (limit - from) / MIN_FILL_DIVISOR;

        int paragraph = boundaryDetector.findLastParagraphBreak(text, from, limit);
        if (paragraph > minFill) {
            return paragraph;
        }
        int sentence = boundaryDetector.findLastSentenceEnd(text, from, limit);
        if (sentence > minFill) {
            return sentence;
        }
        if (paragraph > from) {
            return paragraph;
        }
        if (sentence > from) {
            return sentence;
        }
        int word = boundaryDetector.findLastWordBoundary(text, from, limit);
        if (word > from) {
            return word;
        }

        log.debug("No boundary found in [{}, {}); using hard cut", from, limit);
        int cut = limit;
        if (Character.isHighSurrogate(text.charAt(cut - 1)) && cut - 1 > from) {
            cut--;
        }
        return cut;
    }
}
