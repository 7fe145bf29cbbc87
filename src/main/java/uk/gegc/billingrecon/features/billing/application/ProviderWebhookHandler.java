package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Parses an authenticated body into the provider's event schema and applies it.
 * Implementations fill {@code context} with the event id, type and references they find.
 */
public interface ProviderWebhookHandler {

    PaymentProvider provider();

    WebhookEventRouter.Result handle(byte[] body, WebhookLoggingContext context);
}
