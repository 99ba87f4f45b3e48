package uk.gegc.railintel.shared.exception;

/**
 * Thrown when the provider kept throttling after every allowed retry.
 * Terminal for the call that raised it.
 */
public class RateLimitedException extends AiServiceException {

    private final int attempts;

    public RateLimitedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = Math.max(1, attempts);
    }

    public RateLimitedException(String message, int attempts) {
        this(message, attempts, null);
    }

    public int getAttempts() {
        return attempts;
    }
}
