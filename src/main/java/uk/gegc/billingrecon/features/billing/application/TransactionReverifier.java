package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Confirms a charge with the provider's API before any state is written.
 */
public interface TransactionReverifier {

    PaymentProvider provider();

    /**
     * @param lookupKey         identifier the provider's verify endpoint takes (Paystack reference,
     *                          Flutterwave transaction id)
     * @param expectedReference reference the event claimed; the verified transaction must carry it
     * @throws uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException
     *         when the provider does not confirm a successful charge with that reference
     * @throws uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException
     *         when the provider could not be reached or answered with a server error
     */
    VerifiedTransaction verify(String lookupKey, String expectedReference);
}
