package uk.gegc.railintel.shared.exception;

/**
 * Raised before any network call when the provider credentials are missing or invalid.
 */
public class AiConfigurationException extends AiServiceException {

    public AiConfigurationException(String message) {
        super(message);
    }
}
