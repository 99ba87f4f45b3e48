package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import uk.gegc.railintel.features.ai.domain.CallAttempt;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.domain.model.Chunk;
import uk.gegc.railintel.features.analysis.domain.model.ChunkResult;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.features.analysis.domain.model.SummaryOutcome;
import uk.gegc.railintel.shared.exception.AiConfigurationException;
import uk.gegc.railintel.shared.exception.AiServiceException;
import uk.gegc.railintel.shared.util.TextExcerpts;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs chunk analysis strictly in chunk order and merges the partial results into one summary.
 * <p>
 * A failed chunk is recorded and skipped. If the model turns out to be unconfigured on the first
 * chunk, or every chunk fails, the whole document is re-done with the rule-based analyzer. A
 * single surviving chunk is used as the summary directly; several are merged with one synthesis
 * call, falling back to joining them in order if that call fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryAggregator {

    private final AnalyzerSelector analyzerSelector;
    private final AnalysisProperties properties;
    private final Clock clock;

    public SummaryOutcome summarize(List<Chunk> chunks) {
        return summarize(chunks, analyzerSelector.select());
    }

    public SummaryOutcome summarize(List<Chunk> chunks, DocumentAnalyzer analyzer) {
        if (chunks == null || chunks.isEmpty()) {
            return new SummaryOutcome("", List.of(), ProcessingMode.FALLBACK, false);
        }
        if (analyzer.mode() == ProcessingMode.FALLBACK) {
            return runFallback(chunks, analyzer);
        }

        Instant deadline = clock.instant().plus(properties.getProcessingBudget());
        List<ChunkResult> results = new ArrayList<>(chunks.size());
        boolean cancelled = false;

        for (Chunk chunk : chunks) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Processing interrupted before chunk {} of {}", chunk.index() + 1, chunks.size());
                cancelled = true;
                break;
            }
            if (clock.instant().isAfter(deadline)) {
                log.warn("Processing budget of {} exhausted before chunk {} of {}",
                        properties.getProcessingBudget(), chunk.index() + 1, chunks.size());
                cancelled = true;
                break;
            }
            try (MDC.MDCCloseable ignored = MDC.putCloseable(CallAttempt.CALL_REF_KEY, "chunk-" + chunk.index())) {
                results.add(analyzer.analyzeChunk(chunk, chunks.size()));
            } catch (AiConfigurationException e) {
                if (results.isEmpty()) {
                    log.warn("Language model unavailable ({}); switching to rule-based analysis", e.getMessage());
                    return runFallback(chunks, analyzerSelector.fallback());
                }
                log.warn("Chunk {} of {} failed: {}", chunk.index() + 1, chunks.size(), e.getMessage());
                results.add(ChunkResult.failure(chunk, e.getMessage()));
            } catch (AiServiceException e) {
                log.warn("Chunk {} of {} failed: {}", chunk.index() + 1, chunks.size(), e.getMessage());
                results.add(ChunkResult.failure(chunk, e.getMessage()));
            }
        }

        List<ChunkResult> successful = results.stream().filter(ChunkResult::success).toList();
        if (successful.isEmpty()) {
            log.warn("No chunk could be analysed by the model; using rule-based summary");
            SummaryOutcome fallback = runFallback(chunks, analyzerSelector.fallback());
            List<Integer> failed = results.stream().map(ChunkResult::chunkIndex).toList();
            return new SummaryOutcome(fallback.summary(), fallback.chunkResults(), ProcessingMode.FALLBACK, cancelled, failed);
        }

        boolean complete = !cancelled && successful.size() == chunks.size();
        ProcessingMode mode = complete ? ProcessingMode.AI : ProcessingMode.AI_PARTIAL;

        String summary;
        if (successful.size() == 1) {
            summary = successful.get(0).partialSummary();
        } else if (cancelled) {
            summary = joinPartials(successful);
        } else {
            try (MDC.MDCCloseable ignored = MDC.putCloseable(CallAttempt.CALL_REF_KEY, "synthesis")) {
                summary = analyzer.synthesize(successful);
            } catch (AiServiceException e) {
                log.warn("Summary synthesis failed ({}); joining section summaries instead", e.getMessage());
                summary = joinPartials(successful);
                mode = ProcessingMode.AI_PARTIAL;
            }
        }

        log.info("Summarised {} chunk(s): {} succeeded, mode={}, cancelled={}",
                chunks.size(), successful.size(), mode.getValue(), cancelled);
        return new SummaryOutcome(summary, results, mode, cancelled);
    }

    private SummaryOutcome runFallback(List<Chunk> chunks, DocumentAnalyzer fallback) {
        List<ChunkResult> results = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            results.add(fallback.analyzeChunk(chunk, chunks.size()));
        }
        return new SummaryOutcome(fallback.synthesize(results), results, ProcessingMode.FALLBACK, false);
    }

    private String joinPartials(List<ChunkResult> successful) {
        String joined = successful.stream()
                .map(result -> result.partialSummary().trim())
                .filter(partial -> !partial.isEmpty())
                .collect(Collectors.joining("\n\n"));
        return TextExcerpts.truncateAtSentence(joined, properties.getSynthesisMaxChars());
    }
}
