package uk.gegc.billingrecon.features.billing.application;

/**
 * Picks provider, currency and payment method for a purchase and opens a hosted payment page
 * whose metadata lets the webhook reconcile it. Writes no billing state.
 */
public interface CheckoutSessionService {

    IssuedCheckoutSession createSession(CheckoutSessionCommand command);
}
