package uk.gegc.railintel.features.health.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.features.health.api.dto.HealthResponseDto;

import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service status")
public class HealthController {

    private final LlmClient llmClient;
    private final Clock clock;

    @Operation(summary = "Service status", description = "Reports whether requests will be served by the model or by rules")
    @GetMapping("/health")
    public ResponseEntity<HealthResponseDto> health() {
        ProcessingMode mode = llmClient.isConfigured() ? ProcessingMode.AI : ProcessingMode.FALLBACK;
        return ResponseEntity.ok(new HealthResponseDto("healthy", LocalDateTime.now(clock), mode.getValue()));
    }
}
