package uk.gegc.billingrecon.features.billing.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.billingrecon.features.billing.application.BillingMetricsService;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed metrics. Meters are tagged by provider and event type; the registry
 * caches them per tag set.
 */
@Service
@RequiredArgsConstructor
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementWebhookReceived(PaymentProvider provider) {
        meterRegistry.counter("billing.webhooks.received", "provider", provider.getCode()).increment();
    }

    @Override
    public void incrementWebhookOk(PaymentProvider provider, String eventType) {
        meterRegistry.counter("billing.webhooks.ok", "provider", provider.getCode(), "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookIgnored(PaymentProvider provider, String eventType) {
        meterRegistry.counter("billing.webhooks.ignored", "provider", provider.getCode(), "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookFailed(PaymentProvider provider, String eventType, String reason) {
        meterRegistry.counter("billing.webhooks.failed",
                "provider", provider.getCode(), "event_type", eventType, "reason", reason).increment();
    }

    @Override
    public void recordWebhookLatency(PaymentProvider provider, String eventType, long latencyMs) {
        Timer.builder("billing.webhooks.latency")
                .description("Webhook processing latency")
                .tag("provider", provider.getCode())
                .tag("event_type", eventType)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementReconciliation(PaymentProvider provider, ReconciliationResult.Flow flow) {
        meterRegistry.counter("billing.reconciliations",
                "provider", provider.getCode(), "flow", flow.name().toLowerCase(Locale.ROOT)).increment();
    }
}
