package uk.gegc.railintel.features.analysis.domain.model;

/**
 * A contiguous slice of document text, {@code text == document.substring(startOffset, endOffset)}.
 */
public record Chunk(
        int index,
        String text,
        int estimatedTokens,
        int startOffset,
        int endOffset
) {
    public int length() {
        return endOffset - startOffset;
    }
}
