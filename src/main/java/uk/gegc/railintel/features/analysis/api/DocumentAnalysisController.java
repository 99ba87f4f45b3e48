package uk.gegc.railintel.features.analysis.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.railintel.features.analysis.api.dto.AnalysisResponse;
import uk.gegc.railintel.features.analysis.api.dto.DownloadResponse;
import uk.gegc.railintel.features.analysis.api.dto.ProcessDocumentsRequest;
import uk.gegc.railintel.features.analysis.application.DocumentAnalysisService;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationMode;
import uk.gegc.railintel.features.analysis.infra.mapping.AnalysisResultMapper;

import java.util.Locale;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Document Analysis", description = "Summarise and classify railway documents")
public class DocumentAnalysisController {

    static final String DEFAULT_OCR_LANGUAGE = "eng+mal";
    private static final String TEXT_PLAIN = "text/plain";

    private final DocumentAnalysisService documentAnalysisService;
    private final AnalysisResultMapper analysisResultMapper;

    @Operation(
            summary = "Process documents",
            description = "Extracts text from the listed files, then summarises and classifies them as one document. "
                    + "AI failures never fail the request; the metadata reports degraded processing."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Document analysed",
                    content = @Content(schema = @Schema(implementation = AnalysisResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "No text could be extracted from any file")
    })
    @PostMapping("/process")
    public ResponseEntity<AnalysisResponse> process(@Valid @RequestBody ProcessDocumentsRequest request) {
        String ocrLanguage = request.ocrLanguage() == null || request.ocrLanguage().isBlank()
                ? DEFAULT_OCR_LANGUAGE
                : request.ocrLanguage();
        ClassificationMode mode = ClassificationMode.fromValue(request.classificationMode());
        log.info("Processing {} file(s), ocr_language={}, classification_mode={}",
                request.files().size(), ocrLanguage, mode.getValue());

        AnalysisResult result = documentAnalysisService.process(
                analysisResultMapper.toSourceFiles(request.files()), ocrLanguage, mode);
        return ResponseEntity.ok(analysisResultMapper.toResponse(result));
    }

    @Operation(
            summary = "Prepare a download",
            description = "Returns the OCR text or the summary of a posted analysis as a text file payload"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Download content prepared",
                    content = @Content(schema = @Schema(implementation = DownloadResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Unknown download type")
    })
    @PostMapping("/download/{type}")
    public ResponseEntity<DownloadResponse> download(
            @Parameter(description = "What to download", schema = @Schema(allowableValues = {"ocr", "summary"}))
            @PathVariable String type,
            @RequestBody AnalysisResponse analysis) {
        DownloadResponse response = switch (type.toLowerCase(Locale.ROOT)) {
            case "ocr" -> new DownloadResponse(nullToEmpty(analysis.ocrText()), "ocr_results.txt", TEXT_PLAIN);
            case "summary" -> new DownloadResponse(nullToEmpty(analysis.summary()), "ai_summary.txt", TEXT_PLAIN);
            default -> throw new IllegalArgumentException("Invalid download type: " + type);
        };
        return ResponseEntity.ok(response);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
