package uk.gegc.billingrecon.features.billing.domain.exception;

public class CheckoutAuthenticationRequiredException extends RuntimeException {

    public CheckoutAuthenticationRequiredException(String message) {
        super(message);
    }
}
