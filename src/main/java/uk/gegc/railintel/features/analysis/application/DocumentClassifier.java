package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.analysis.config.ClassificationProperties;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores a document against the fixed {@link DocumentCategory} set.
 * <p>
 * Per chunk, a category's signal is its keyword score, blended with the model's evidence when the
 * chunk has any. The document score is the strongest chunk signal plus a small bonus for the share
 * of chunks that also support the category. Confidences are in [0,1], rounded to two decimals,
 * sorted descending (ties broken by category order) and thresholded. The result depends only on
 * its inputs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentClassifier {

    static final double AI_WEIGHT = 0.6;
    static final double RULE_WEIGHT = 0.4;
    static final double FREQUENCY_BONUS = 0.1;
    static final double OPERATOR_BOOST_FACTOR = 0.5;
    static final double GENERAL_STRONG_CONFIDENCE = 0.3;
    static final double GENERAL_WEAK_CONFIDENCE = 0.2;
    static final double GENERAL_RELEVANCE_THRESHOLD = 0.2;

    private static final Comparator<ClassificationEntry> BY_CONFIDENCE =
            Comparator.comparingDouble(ClassificationEntry::confidence).reversed()
                    .thenComparing(entry -> entry.category().ordinal());

    private final ClassificationProperties properties;

    /**
     * @param chunks       the document's chunks
     * @param chunkResults per-chunk results; failed or missing results count as rule-only chunks
     * @return entries sorted by descending confidence, empty only for an empty document
     */
    public List<ClassificationEntry> classify(List<Chunk> chunks, List<ChunkResult> chunkResults) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }

        Map<Integer, ChunkResult> resultsByIndex = new HashMap<>();
        if (chunkResults != null) {
            for (ChunkResult result : chunkResults) {
                if (result.success()) {
                    resultsByIndex.put(result.chunkIndex(), result);
                }
            }
        }

        List<String> normalized = chunks.stream().map(chunk -> DocumentCategory.normalize(chunk.text())).toList();
        double operatorRelevance = operatorRelevance(normalized);
        double minConfidence = properties.getMinConfidence();

        List<ClassificationEntry> entries = new ArrayList<>();
        for (DocumentCategory category : DocumentCategory.values()) {
            if (!category.isScored()) {
                continue;
            }
            double max = 0.0;
            int supporting = 0;
            for (int i = 0; i < chunks.size(); i++) {
                double signal = chunkSignal(category, normalized.get(i), resultsByIndex.get(chunks.get(i).index()));
                max = Math.max(max, signal);
                if (signal >= minConfidence) {
                    supporting++;
                }
            }
            double confidence = max;
            if (chunks.size() > 1 && supporting > 1) {
                confidence += FREQUENCY_BONUS * (supporting - 1) / (chunks.size() - 1);
            }
            confidence = clamp(confidence);
            if (confidence < minConfidence) {
                continue;
            }
            if (operatorRelevance > properties.getOperatorBoostThreshold()) {
                confidence = clamp(confidence * (1 + operatorRelevance * OPERATOR_BOOST_FACTOR));
            }
            entries.add(new ClassificationEntry(category, round(confidence), round(operatorRelevance)));
        }

        entries.sort(BY_CONFIDENCE);
        List<ClassificationEntry> top = entries.size() > properties.getMaxResults()
                ? new ArrayList<>(entries.subList(0, Math.max(0, properties.getMaxResults())))
                : entries;

        if (top.isEmpty() && normalized.stream().anyMatch(text -> !text.isEmpty())) {
            double confidence = operatorRelevance > GENERAL_RELEVANCE_THRESHOLD
                    ? GENERAL_STRONG_CONFIDENCE
                    : GENERAL_WEAK_CONFIDENCE;
            log.debug("No category reached {}; reporting general railway document", minConfidence);
            return List.of(new ClassificationEntry(DocumentCategory.GENERAL_RAILWAY_DOCUMENT,
                    confidence, round(operatorRelevance)));
        }

        log.debug("Classified document into {} categor(ies); operator relevance {}", top.size(), operatorRelevance);
        return List.copyOf(top);
    }

    /**
     * Share of operator keywords present anywhere in the document, doubled and capped at 1.
     */
    double operatorRelevance(List<String> normalizedChunks) {
        List<String> keywords = properties.getOperatorKeywords();
        if (keywords == null || keywords.isEmpty()) {
            return 0.0;
        }
        int matched = 0;
        for (String keyword : keywords) {
            String needle = DocumentCategory.normalize(keyword.toLowerCase(Locale.ROOT));
            if (!needle.isEmpty() && normalizedChunks.stream().anyMatch(text -> text.contains(needle))) {
                matched++;
            }
        }
        return Math.min(1.0, (double) matched / keywords.size() * 2);
    }

    private double chunkSignal(DocumentCategory category, String normalizedText, ChunkResult result) {
        double rule = category.ruleSignal(normalizedText);
        Double ai = result == null ? null : result.categoryEvidence().get(category);
        if (ai == null) {
            return rule;
        }
        return clamp(AI_WEIGHT * ai + RULE_WEIGHT * rule);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
