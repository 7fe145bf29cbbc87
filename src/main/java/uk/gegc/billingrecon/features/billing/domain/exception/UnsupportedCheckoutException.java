package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * The requested provider, plan or payment method combination cannot be checked out.
 */
public class UnsupportedCheckoutException extends RuntimeException {

    public UnsupportedCheckoutException(String message) {
        super(message);
    }
}
