package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Creates a provider-hosted payment page.
 */
public interface CheckoutGateway {

    PaymentProvider provider();

    /**
     * Whether every credential this gateway needs is present.
     */
    boolean isConfigured();

    /**
     * @return URL of the hosted payment page
     */
    String createSession(GatewayCheckoutRequest request);
}
