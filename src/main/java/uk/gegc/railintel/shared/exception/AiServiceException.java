package uk.gegc.railintel.shared.exception;

/**
 * Base exception for failures talking to the language-model provider.
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
