package uk.gegc.railintel.shared.exception;

/**
 * Non-transient provider failure: authentication, malformed request, network or model error.
 * Never retried.
 */
public class ProviderException extends AiServiceException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
