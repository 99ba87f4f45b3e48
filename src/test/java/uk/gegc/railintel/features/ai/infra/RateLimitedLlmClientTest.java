package uk.gegc.railintel.features.ai.infra;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import uk.gegc.railintel.features.ai.application.PacingGate;
import uk.gegc.railintel.shared.config.AiRateLimitConfig;
import uk.gegc.railintel.shared.exception.AiConfigurationException;
import uk.gegc.railintel.shared.exception.ProviderException;
import uk.gegc.railintel.shared.exception.RateLimitedException;
import uk.gegc.railintel.testsupport.MutableClock;
import uk.gegc.railintel.testsupport.RecordingSleeper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitedLlmClient Tests")
class RateLimitedLlmClientTest {

    private static final Duration RETRY_DELAY = Duration.ofSeconds(10);

    @Mock
    private ChatModel chatModel;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private AiRateLimitConfig config;
    private SimpleMeterRegistry meterRegistry;
    private RateLimitedLlmClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-12T09:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        config = new AiRateLimitConfig();
        config.setChunkDelay(Duration.ofSeconds(1));
        config.setRateLimitRetryDelay(RETRY_DELAY);
        config.setMaxRetries(3);
        meterRegistry = new SimpleMeterRegistry();
        client = newClient(chatModel);
    }

    private RateLimitedLlmClient newClient(ChatModel model) {
        PacingGate gate = new PacingGate(clock, sleeper, config.getChunkDelay());
        return new RateLimitedLlmClient(model, gate, config, sleeper, meterRegistry);
    }

    private static ChatResponse completion(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private static HttpClientErrorException tooManyRequests() {
        return HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                HttpHeaders.EMPTY, null, null);
    }

    private double count(String outcome) {
        return meterRegistry.counter("railintel.ai.calls", "outcome", outcome).count();
    }

    @Nested
    @DisplayName("Successful calls")
    class SuccessfulCalls {

        @Test
        @DisplayName("Returns the completion text and sends context as a system message")
        void returnsCompletionText() {
            // Given
            when(chatModel.call(any(Prompt.class))).thenReturn(completion("Track inspection summary"));

            // When
            String result = client.call("Summarise the section", "You analyse railway documents");

            // Then
            assertThat(result).isEqualTo("Track inspection summary");
            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(chatModel).call(captor.capture());
            assertThat(captor.getValue().getInstructions()).hasSize(2);
            assertThat(captor.getValue().getInstructions().get(0)).isInstanceOf(SystemMessage.class);
            assertThat(captor.getValue().getInstructions().get(1)).isInstanceOf(UserMessage.class);
            assertThat(count("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Omits the system message when there is no context")
        void omitsBlankContext() {
            when(chatModel.call(any(Prompt.class))).thenReturn(completion("ok"));

            client.call("Question", "  ");

            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(chatModel).call(captor.capture());
            assertThat(captor.getValue().getInstructions()).hasSize(1);
        }

        @Test
        @DisplayName("Recovers after a throttled attempt with one fixed delay")
        void recoversAfterThrottling() {
            // Given
            when(chatModel.call(any(Prompt.class)))
                    .thenThrow(tooManyRequests())
                    .thenReturn(completion("second time lucky"));

            // When
            String result = client.call("prompt", null);

            // Then
            assertThat(result).isEqualTo("second time lucky");
            verify(chatModel, times(2)).call(any(Prompt.class));
            assertThat(sleeper.getSleeps()).containsExactly(RETRY_DELAY);
            assertThat(count("rate_limited")).isEqualTo(1.0);
            assertThat(count("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Consecutive calls are paced by the chunk delay")
        void consecutiveCallsArePaced() {
            when(chatModel.call(any(Prompt.class))).thenReturn(completion("a"), completion("b"));

            client.call("first", null);
            client.call("second", null);

            assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Persistent throttling fails after maxRetries + 1 attempts")
        void persistentThrottlingFails() {
            // Given
            when(chatModel.call(any(Prompt.class))).thenThrow(tooManyRequests());

            // When / Then
            assertThatThrownBy(() -> client.call("prompt", null))
                    .isInstanceOf(RateLimitedException.class)
                    .satisfies(ex -> assertThat(((RateLimitedException) ex).getAttempts()).isEqualTo(4));
            verify(chatModel, times(4)).call(any(Prompt.class));
            assertThat(sleeper.getSleeps()).containsExactly(RETRY_DELAY, RETRY_DELAY, RETRY_DELAY);
            assertThat(count("rate_limited")).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Zero retries means a single attempt")
        void zeroRetriesMeansSingleAttempt() {
            config.setMaxRetries(0);
            RateLimitedLlmClient noRetry = newClient(chatModel);
            when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("HTTP 429 - rate limit reached"));

            assertThatThrownBy(() -> noRetry.call("prompt", null))
                    .isInstanceOf(RateLimitedException.class);
            verify(chatModel, times(1)).call(any(Prompt.class));
            assertThat(sleeper.getSleeps()).isEmpty();
        }

        @Test
        @DisplayName("Non-throttling provider errors are not retried")
        void otherErrorsAreNotRetried() {
            when(chatModel.call(any(Prompt.class))).thenThrow(HttpClientErrorException.create(
                    HttpStatus.UNAUTHORIZED, "Unauthorized", HttpHeaders.EMPTY, null, null));

            assertThatThrownBy(() -> client.call("prompt", null))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("Language-model call failed");
            verify(chatModel, times(1)).call(any(Prompt.class));
            assertThat(sleeper.getSleeps()).isEmpty();
            assertThat(count("fatal")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Empty completion is a provider failure")
        void emptyCompletionFails() {
            when(chatModel.call(any(Prompt.class))).thenReturn(completion("   "));

            assertThatThrownBy(() -> client.call("prompt", null))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("empty completion");
            verify(chatModel, times(1)).call(any(Prompt.class));
        }

        @Test
        @DisplayName("Missing credentials fail fast without calling the provider")
        void missingCredentialsFailFast() {
            RateLimitedLlmClient unconfigured = newClient(null);

            assertThat(unconfigured.isConfigured()).isFalse();
            assertThatThrownBy(() -> unconfigured.call("prompt", null))
                    .isInstanceOf(AiConfigurationException.class);
            verify(chatModel, never()).call(any(Prompt.class));
            assertThat(count("not_configured")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Blank prompt is rejected")
        void blankPromptRejected() {
            assertThatThrownBy(() -> client.call(" ", "context"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Interruption during backoff surfaces as a provider failure and keeps the flag")
        void interruptionDuringBackoff() {
            // Given
            PacingGate gate = new PacingGate(clock, sleeper, Duration.ZERO);
            RateLimitedLlmClient interrupted = new RateLimitedLlmClient(chatModel, gate, config,
                    duration -> {
                        throw new InterruptedException("stop");
                    }, meterRegistry);
            when(chatModel.call(any(Prompt.class))).thenThrow(tooManyRequests());

            try {
                // When / Then
                assertThatThrownBy(() -> interrupted.call("prompt", null))
                        .isInstanceOf(ProviderException.class)
                        .hasMessageContaining("Interrupted");
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Throttling detection")
    class ThrottlingDetection {

        @Test
        @DisplayName("Recognises status and provider wording anywhere in the cause chain")
        void recognisesThrottling() {
            assertThat(RateLimitedLlmClient.isRateLimitError(tooManyRequests())).isTrue();
            assertThat(RateLimitedLlmClient.isRateLimitError(
                    new NonTransientAiException("HTTP 429 - {\"error\":\"quota\"}"))).isTrue();
            assertThat(RateLimitedLlmClient.isRateLimitError(new RuntimeException("status code: 429"))).isTrue();
            assertThat(RateLimitedLlmClient.isRateLimitError(new RuntimeException("Rate limit exceeded"))).isTrue();
            assertThat(RateLimitedLlmClient.isRateLimitError(
                    new IllegalStateException("wrapped", new RuntimeException("RateLimitReached")))).isTrue();
        }

        @Test
        @DisplayName("Other failures are not throttling")
        void otherFailuresAreNotThrottling() {
            assertThat(RateLimitedLlmClient.isRateLimitError(new RuntimeException("401 Unauthorized"))).isFalse();
            assertThat(RateLimitedLlmClient.isRateLimitError(new NonTransientAiException(
                    "HTTP 401 - {\"error\":\"invalid key sk-4291abc\",\"request_id\":\"req-429\"}"))).isFalse();
            assertThat(RateLimitedLlmClient.isRateLimitError(new RuntimeException("401 Unauthorized (trace 7429)"))).isFalse();
            assertThat(RateLimitedLlmClient.isRateLimitError(new RuntimeException((String) null))).isFalse();
        }
    }
}
