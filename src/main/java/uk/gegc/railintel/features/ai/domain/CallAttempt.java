package uk.gegc.railintel.features.ai.domain;

import java.time.Duration;
import java.util.Locale;

/**
 * One attempt at a provider call. Only kept long enough to be logged and counted.
 *
 * @param callRef what the call was for, e.g. {@code chunk-2}, {@code synthesis} or {@code chat};
 *                taken from the {@value #CALL_REF_KEY} MDC entry
 */
public record CallAttempt(
        String callRef,
        int attemptNumber,
        Outcome outcome,
        Duration elapsedWait
) {

    public static final String CALL_REF_KEY = "ai_call";

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        FATAL
    }

    public String outcomeTag() {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
