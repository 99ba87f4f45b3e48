package uk.gegc.railintel.features.ai.infra;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.railintel.features.ai.application.LlmClient;
import uk.gegc.railintel.features.ai.application.PacingGate;
import uk.gegc.railintel.features.ai.application.Sleeper;
import uk.gegc.railintel.features.ai.domain.CallAttempt;
import uk.gegc.railintel.shared.config.AiRateLimitConfig;
import uk.gegc.railintel.shared.exception.AiConfigurationException;
import uk.gegc.railintel.shared.exception.ProviderException;
import uk.gegc.railintel.shared.exception.RateLimitedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * {@link LlmClient} that paces every attempt through the shared {@link PacingGate} and retries
 * throttled calls after a fixed delay. All other provider failures are surfaced immediately.
 */
@Slf4j
public class RateLimitedLlmClient implements LlmClient {

    private static final Logger callLog = LoggerFactory.getLogger("ai.calls");
    private static final int TOO_MANY_REQUESTS = 429;
    private static final Pattern THROTTLED_STATUS = Pattern.compile(
            "^\\s*(?:HTTP\\s*)?429\\b|\\b(?:HTTP|status(?:\\s*code)?)[\\s:=]*429\\b", Pattern.CASE_INSENSITIVE);

    private final ChatModel chatModel;
    private final PacingGate pacingGate;
    private final AiRateLimitConfig rateLimitConfig;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    /**
     * @param chatModel provider model, {@code null} when no credentials are configured
     */
    public RateLimitedLlmClient(ChatModel chatModel,
                                PacingGate pacingGate,
                                AiRateLimitConfig rateLimitConfig,
                                Sleeper sleeper,
                                MeterRegistry meterRegistry) {
        this.chatModel = chatModel;
        this.pacingGate = pacingGate;
        this.rateLimitConfig = rateLimitConfig;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean isConfigured() {
        return chatModel != null;
    }

    @Override
    public String call(String prompt, String context) {
        if (prompt == null || prompt.trim().isEmpty()) {
            throw new IllegalArgumentException("Prompt cannot be null or empty");
        }
        if (chatModel == null) {
            meterRegistry.counter("railintel.ai.calls", "outcome", "not_configured").increment();
            throw new AiConfigurationException("Language-model credentials are not configured");
        }

        Prompt request = buildPrompt(prompt, context);
        String callRef = MDC.get(CallAttempt.CALL_REF_KEY);
        int maxRetries = Math.max(0, rateLimitConfig.getMaxRetries());
        Duration pendingBackoff = Duration.ZERO;
        int attempt = 0;

        while (true) {
            attempt++;
            Duration waited = pendingBackoff.plus(awaitTurn());
            try {
                ChatResponse response = chatModel.call(request);
                String text = extractText(response);
                record(new CallAttempt(callRef, attempt, CallAttempt.Outcome.SUCCESS, waited));
                return text;
            } catch (ProviderException e) {
                record(new CallAttempt(callRef, attempt, CallAttempt.Outcome.FATAL, waited));
                throw e;
            } catch (RuntimeException e) {
                if (!isRateLimitError(e)) {
                    record(new CallAttempt(callRef, attempt, CallAttempt.Outcome.FATAL, waited));
                    throw new ProviderException("Language-model call failed: " + e.getMessage(), e);
                }

                record(new CallAttempt(callRef, attempt, CallAttempt.Outcome.RATE_LIMITED, waited));
                if (attempt > maxRetries) {
                    throw new RateLimitedException(
                            "Rate limit exceeded after " + attempt + " attempts", attempt, e);
                }

                pendingBackoff = rateLimitConfig.getRateLimitRetryDelay();
                log.warn("Rate limit hit (attempt {} of {}). Waiting {} ms before retry.",
                        attempt, maxRetries + 1, pendingBackoff.toMillis());
                pause(pendingBackoff);
            }
        }
    }

    private Prompt buildPrompt(String prompt, String context) {
        List<Message> messages = new ArrayList<>(2);
        if (context != null && !context.isBlank()) {
            messages.add(new SystemMessage(context));
        }
        messages.add(new UserMessage(prompt));
        log.debug("Built prompt: {} chars of context, {} chars of instruction",
                context == null ? 0 : context.length(), prompt.length());
        return new Prompt(messages);
    }

    private String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ProviderException("No response received from language-model provider");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ProviderException("Language-model provider returned an empty completion");
        }
        return text;
    }

    private Duration awaitTurn() {
        try {
            return pacingGate.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for the pacing gate", ie);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for rate limit", ie);
        }
    }

    private void record(CallAttempt attempt) {
        callLog.info("call={} attempt={} outcome={} waitedMs={}",
                attempt.callRef() == null ? "-" : attempt.callRef(),
                attempt.attemptNumber(), attempt.outcomeTag(), attempt.elapsedWait().toMillis());
        meterRegistry.counter("railintel.ai.calls", "outcome", attempt.outcomeTag()).increment();
    }

    /**
     * Throttling is recognised from the HTTP status where available, otherwise from the
     * provider's error text anywhere in the cause chain. A bare "429" only counts as a status
     * at the start of the message or after "HTTP" / "status", as in Spring AI's "HTTP 429 - ...".
     */
    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RestClientResponseException
                    && ((RestClientResponseException) current).getStatusCode().value() == TOO_MANY_REQUESTS) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && (THROTTLED_STATUS.matcher(message).find()
                    || message.toLowerCase(Locale.ROOT).contains("rate limit")
                    || message.contains("rate_limit_exceeded")
                    || message.contains("RateLimitReached")
                    || message.contains("Too Many Requests"))) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
