package uk.gegc.billingrecon.features.billing.application;

import java.util.UUID;

/**
 * Lets a signed-in buyer returning from the hosted page apply their purchase without waiting
 * for the webhook. Runs the same reconciliation, so the webhook arriving later is a no-op.
 */
public interface CheckoutConfirmationService {

    record Confirmation(String provider, String reference, String planId, String subscriptionCode) {
    }

    /**
     * @param transactionId required for Flutterwave, which verifies by transaction id
     * @throws uk.gegc.billingrecon.features.billing.domain.exception.CheckoutOwnershipException
     *         when the charge belongs to another user
     */
    Confirmation confirm(UUID callerId, String provider, String reference, String transactionId);
}
