package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * Request or event payload is missing a required field or carries an invalid value.
 * Thrown before any write is attempted.
 */
public class BillingValidationException extends RuntimeException {

    public BillingValidationException(String message) {
        super(message);
    }

    public BillingValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
