package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Webhook and reconciliation counters.
 */
public interface BillingMetricsService {

    void incrementWebhookReceived(PaymentProvider provider);
    void incrementWebhookOk(PaymentProvider provider, String eventType);
    void incrementWebhookIgnored(PaymentProvider provider, String eventType);
    void incrementWebhookFailed(PaymentProvider provider, String eventType, String reason);

    void recordWebhookLatency(PaymentProvider provider, String eventType, long latencyMs);

    void incrementReconciliation(PaymentProvider provider, ReconciliationResult.Flow flow);
}
