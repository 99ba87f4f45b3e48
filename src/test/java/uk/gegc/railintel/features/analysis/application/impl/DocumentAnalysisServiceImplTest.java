package uk.gegc.railintel.features.analysis.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.railintel.BaseUnitTest;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.ai.application.impl.PromptTemplateServiceImpl;
import uk.gegc.railintel.features.analysis.application.AiDocumentAnalyzer;
import uk.gegc.railintel.features.analysis.application.AnalyzerSelector;
import uk.gegc.railintel.features.analysis.application.DocumentClassifier;
import uk.gegc.railintel.features.analysis.application.KeyInformationExtractor;
import uk.gegc.railintel.features.analysis.application.RuleBasedDocumentAnalyzer;
import uk.gegc.railintel.features.analysis.application.SummaryAggregator;
import uk.gegc.railintel.features.analysis.application.TextChunker;
import uk.gegc.railintel.features.analysis.application.TokenCounter;
import uk.gegc.railintel.features.analysis.config.AnalysisProperties;
import uk.gegc.railintel.features.analysis.config.ClassificationProperties;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationMode;
import uk.gegc.railintel.features.analysis.domain.model.Document;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.features.ocr.application.OcrService;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.OcrExtraction;
import uk.gegc.railintel.features.ocr.domain.OcrPage;
import uk.gegc.railintel.features.ocr.domain.SourceFile;
import uk.gegc.railintel.shared.exception.DocumentProcessingException;
import uk.gegc.railintel.shared.exception.ProviderException;
import uk.gegc.railintel.shared.util.SentenceBoundaryDetector;
import uk.gegc.railintel.testsupport.MutableClock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DocumentAnalysisServiceImpl Tests")
class DocumentAnalysisServiceImplTest extends BaseUnitTest {

    private static final String CIRCULAR = """
            STATION SAFETY CIRCULAR

            Issued 12 March 2024.

            Safety first. Report every hazard and emergency to the control room. \
            Risk assessment before work on the track is mandatory.
            """;

    @Mock
    private LlmClient llmClient;

    @Mock
    private OcrService ocrService;

    private AnalysisProperties analysisProperties;
    private SimpleMeterRegistry meterRegistry;
    private DocumentAnalysisServiceImpl service;

    @BeforeEach
    void setUp() {
        analysisProperties = new AnalysisProperties();
        MutableClock clock = new MutableClock(Instant.parse("2024-03-12T09:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();

        KeyInformationExtractor keyInformationExtractor = new KeyInformationExtractor(analysisProperties);
        RuleBasedDocumentAnalyzer ruleBased = new RuleBasedDocumentAnalyzer(analysisProperties, keyInformationExtractor);
        AiDocumentAnalyzer ai = new AiDocumentAnalyzer(llmClient,
                new PromptTemplateServiceImpl(new DefaultResourceLoader()), analysisProperties);
        AnalyzerSelector selector = new AnalyzerSelector(llmClient, ai, ruleBased);

        service = new DocumentAnalysisServiceImpl(
                ocrService,
                new TextChunker(new TokenCounter(), new SentenceBoundaryDetector()),
                selector,
                new SummaryAggregator(selector, analysisProperties, clock),
                new DocumentClassifier(new ClassificationProperties()),
                keyInformationExtractor,
                analysisProperties,
                meterRegistry,
                clock);
    }

    private static Document document(String text) {
        return new Document(text, Set.of("eng"), 1);
    }

    @Nested
    @DisplayName("Without model credentials")
    class WithoutCredentials {

        @BeforeEach
        void noCredentials() {
            when(llmClient.isConfigured()).thenReturn(false);
        }

        @Test
        @DisplayName("Railway text still gets a summary, a classification and key information")
        void ruleBasedAnalysis() {
            // When
            AnalysisResult result = service.analyze(document(CIRCULAR), 1, "eng+mal", ClassificationMode.RAILWAY);

            // Then
            assertThat(result.summary()).isNotBlank().startsWith("Document overview:");
            assertThat(result.classification()).isNotEmpty();
            assertThat(result.classification().get(0).category()).isEqualTo(DocumentCategory.SAFETY_MANUAL);
            assertThat(result.documentType()).isEqualTo("Safety Manual");
            assertThat(result.keyInformation().get(KeyInformationExtractor.DATES)).contains("12 March 2024");
            assertThat(result.insights()).isNotNull();
            assertThat(result.ocrText()).isEqualTo(CIRCULAR);

            assertThat(result.metadata().processingMode()).isEqualTo(ProcessingMode.FALLBACK);
            assertThat(result.metadata().degraded()).isTrue();
            assertThat(result.metadata().notice()).contains("rule-based");
            assertThat(result.metadata().ocrLanguage()).isEqualTo("eng+mal");
            assertThat(result.metadata().totalCharacters()).isEqualTo(CIRCULAR.length());
            assertThat(meterRegistry.counter("railintel.analysis.runs", "mode", "fallback").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Long documents are split into several chunks")
        void longDocumentsAreChunked() {
            analysisProperties.setMaxTokensPerChunk(20);

            AnalysisResult result = service.analyze(document(CIRCULAR), 1, "eng", ClassificationMode.RAILWAY);

            assertThat(result.metadata().chunkCount()).isGreaterThan(1);
            assertThat(result.summary()).contains("Section 1:");
        }

        @Test
        @DisplayName("General mode skips railway classification")
        void generalMode() {
            AnalysisResult result = service.analyze(document(CIRCULAR), 1, "eng", ClassificationMode.GENERAL);

            assertThat(result.classification()).isEmpty();
            assertThat(result.insights()).isNull();
            assertThat(result.documentType()).isEqualTo(DocumentAnalysisServiceImpl.GENERAL_DOCUMENT);
        }
    }

    @Test
    @DisplayName("Empty text produces the empty-document result without any model call")
    void emptyDocument() {
        AnalysisResult result = service.analyze(document("  \n "), 1, "eng", ClassificationMode.RAILWAY);

        assertThat(result.summary()).isEqualTo(DocumentAnalysisServiceImpl.EMPTY_SUMMARY);
        assertThat(result.documentType()).isEqualTo(DocumentAnalysisServiceImpl.UNKNOWN_DOCUMENT);
        assertThat(result.classification()).isEmpty();
        assertThat(result.metadata().processingMode()).isEqualTo(ProcessingMode.FALLBACK);
        assertThat(result.metadata().chunkCount()).isZero();
    }

    @Test
    @DisplayName("Model analysis provides the document type and a non-degraded result")
    void modelAnalysis() {
        // Given
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(anyString(), anyString())).thenReturn("""
                {"summary": "A station safety circular about hazard reporting.",
                 "document_type": "Station Safety Circular",
                 "categories": {"safety_manual": 0.8},
                 "key_information": {"responsible_parties": ["Control room"]}}
                """);

        // When
        AnalysisResult result = service.analyze(document(CIRCULAR), 1, "eng", ClassificationMode.BOTH);

        // Then
        assertThat(result.documentType()).isEqualTo("Station Safety Circular");
        assertThat(result.summary()).isEqualTo("A station safety circular about hazard reporting.");
        assertThat(result.classification().get(0).category()).isEqualTo(DocumentCategory.SAFETY_MANUAL);
        assertThat(result.keyInformation()).containsKey("responsible_parties");
        assertThat(result.metadata().processingMode()).isEqualTo(ProcessingMode.AI);
        assertThat(result.metadata().degraded()).isFalse();
        assertThat(result.metadata().notice()).isNull();
        verify(llmClient, times(1)).call(anyString(), anyString());
    }

    @Test
    @DisplayName("Model failing on every section is reported in the metadata")
    void modelFailsEverySection() {
        // Given
        analysisProperties.setMaxTokensPerChunk(20);
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(anyString(), anyString())).thenThrow(new ProviderException("upstream 500"));

        // When
        AnalysisResult result = service.analyze(document(CIRCULAR), 1, "eng", ClassificationMode.RAILWAY);

        // Then
        int chunkCount = result.metadata().chunkCount();
        assertThat(chunkCount).isGreaterThan(1);
        assertThat(result.metadata().processingMode()).isEqualTo(ProcessingMode.FALLBACK);
        assertThat(result.metadata().failedChunks()).hasSize(chunkCount).startsWith(0);
        assertThat(result.metadata().notice())
                .contains("AI analysis failed for " + chunkCount + " of " + chunkCount + " section(s)");
        assertThat(result.summary()).isNotBlank();
    }

    @Nested
    @DisplayName("process")
    class Process {

        private final SourceFile missing = new SourceFile(Path.of("/uploads/a1"), "a.pdf");
        private final SourceFile present = new SourceFile(Path.of("/uploads/b2"), "b.txt");

        @Test
        @DisplayName("Unreadable files are skipped and the rest are combined")
        void skipsUnreadableFiles() throws Exception {
            // Given
            when(llmClient.isConfigured()).thenReturn(false);
            when(ocrService.extract(eq(missing), anyString())).thenThrow(new ExtractionException("File not found: a.pdf"));
            when(ocrService.extract(eq(present), anyString())).thenReturn(new OcrExtraction("b.txt", List.of(
                    new OcrPage(1, CIRCULAR, "eng"),
                    new OcrPage(2, "സുരക്ഷാ നിർദ്ദേശങ്ങൾ", "mal"))));

            // When
            AnalysisResult result = service.process(List.of(missing, present), "eng+mal", ClassificationMode.RAILWAY);

            // Then
            assertThat(result.metadata().totalPages()).isEqualTo(2);
            assertThat(result.metadata().filesProcessed()).isEqualTo(1);
            assertThat(result.metadata().languagesDetected()).containsExactly("eng", "mal");
            assertThat(result.ocrText()).contains("--- Document: b.txt ---").contains("Report every hazard");
        }

        @Test
        @DisplayName("Fails when no file yields any text")
        void failsWhenNothingExtracted() throws Exception {
            when(ocrService.extract(eq(missing), anyString())).thenThrow(new ExtractionException("File not found: a.pdf"));
            when(ocrService.extract(eq(present), anyString())).thenReturn(new OcrExtraction("b.txt", List.of()));

            assertThatThrownBy(() -> service.process(List.of(missing, present), "eng", ClassificationMode.RAILWAY))
                    .isInstanceOf(DocumentProcessingException.class)
                    .hasMessageContaining("2 file(s)");
        }

        @Test
        @DisplayName("Fails when no files are given")
        void failsWithoutFiles() {
            assertThatThrownBy(() -> service.process(List.of(), "eng", ClassificationMode.RAILWAY))
                    .isInstanceOf(DocumentProcessingException.class);
        }
    }
}
