package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Authenticates a webhook delivery and dispatches it to the provider's handler.
 */
public interface WebhookEventRouter {

    enum Result {
        /** A recognized event was applied. */
        PROCESSED,
        /** Authentic but not actionable; acknowledged so the provider stops retrying. */
        IGNORED
    }

    Result route(PaymentProvider provider, WebhookDelivery delivery);
}
