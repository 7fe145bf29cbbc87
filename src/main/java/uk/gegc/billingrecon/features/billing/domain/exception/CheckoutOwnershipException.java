package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * The confirmed transaction was issued for a different user than the caller.
 */
public class CheckoutOwnershipException extends RuntimeException {

    public CheckoutOwnershipException(String message) {
        super(message);
    }
}
