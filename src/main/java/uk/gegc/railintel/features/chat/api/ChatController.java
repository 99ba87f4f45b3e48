package uk.gegc.railintel.features.chat.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.infra.mapping.AnalysisResultMapper;
import uk.gegc.railintel.features.chat.api.dto.ChatRequestDto;
import uk.gegc.railintel.features.chat.api.dto.ChatResponseDto;
import uk.gegc.railintel.features.chat.api.dto.ChatTurnDto;
import uk.gegc.railintel.features.chat.application.ChatContextBuilder;
import uk.gegc.railintel.features.chat.domain.ChatReply;
import uk.gegc.railintel.features.chat.domain.ChatTurn;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Document Chat", description = "Questions and answers about a processed document")
public class ChatController {

    private final ChatContextBuilder chatContextBuilder;
    private final AnalysisResultMapper analysisResultMapper;
    private final Clock clock;

    @Operation(
            summary = "Ask about a processed document",
            description = "Answers with the language model when available, otherwise from the stored analysis. "
                    + "Provider failures never fail the request."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Answer generated",
                    content = @Content(schema = @Schema(implementation = ChatResponseDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Missing or invalid message")
    })
    @PostMapping("/chat")
    public ResponseEntity<ChatResponseDto> chat(@Valid @RequestBody ChatRequestDto request) {
        log.info("Chat request received ({} chars, document attached: {})",
                request.message().length(), request.processedData() != null);

        AnalysisResult analysis = analysisResultMapper.fromResponse(request.processedData());
        ChatReply reply = chatContextBuilder.respond(request.message(), analysis, toTurns(request.history()));
        return ResponseEntity.ok(new ChatResponseDto(reply.response(), reply.aiGenerated(), LocalDateTime.now(clock)));
    }

    private List<ChatTurn> toTurns(List<ChatTurnDto> history) {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .filter(turn -> turn != null && turn.content() != null)
                .map(turn -> new ChatTurn(
                        "assistant".equalsIgnoreCase(turn.role()) ? ChatTurn.Role.ASSISTANT : ChatTurn.Role.USER,
                        turn.content()))
                .toList();
    }
}
