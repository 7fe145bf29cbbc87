package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * An event referenced a provider subscription code that has no local row.
 */
public class SubscriptionNotFoundException extends RuntimeException {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }
}
