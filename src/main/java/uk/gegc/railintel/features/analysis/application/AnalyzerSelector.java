package uk.gegc.railintel.features.analysis.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.ai.application.LlmClient;

/**
 * Picks the analyzer for one request. The choice is made once so that a document is never
 * analysed with a mix of strategies except through the aggregator's explicit fallback.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyzerSelector {

    private final LlmClient llmClient;
    private final AiDocumentAnalyzer aiDocumentAnalyzer;
    private final RuleBasedDocumentAnalyzer ruleBasedDocumentAnalyzer;

    public DocumentAnalyzer select() {
        if (llmClient.isConfigured()) {
            return aiDocumentAnalyzer;
        }
        log.info("No language-model credentials configured; using rule-based analysis");
        return ruleBasedDocumentAnalyzer;
    }

    public RuleBasedDocumentAnalyzer fallback() {
        return ruleBasedDocumentAnalyzer;
    }
}
