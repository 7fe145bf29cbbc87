package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * A secret or setting the operation needs is not configured.
 */
public class BillingConfigurationException extends RuntimeException {

    public BillingConfigurationException(String message) {
        super(message);
    }

    public BillingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
