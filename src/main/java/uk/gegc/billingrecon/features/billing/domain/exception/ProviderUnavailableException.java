package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * An outbound call to a payment provider failed, timed out or returned an unusable answer.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
