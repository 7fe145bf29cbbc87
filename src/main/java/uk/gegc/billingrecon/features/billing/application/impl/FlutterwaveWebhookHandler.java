package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.BillingMetricsService;
import uk.gegc.billingrecon.features.billing.application.ProviderWebhookHandler;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.application.SubscriptionReconciler;
import uk.gegc.billingrecon.features.billing.application.TransactionReverifierRegistry;
import uk.gegc.billingrecon.features.billing.application.VerifiedTransaction;
import uk.gegc.billingrecon.features.billing.application.WebhookEventRouter.Result;
import uk.gegc.billingrecon.features.billing.application.WebhookLoggingContext;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.event.FlutterwaveCharge;
import uk.gegc.billingrecon.features.billing.domain.event.FlutterwaveEvent;
import uk.gegc.billingrecon.features.billing.domain.event.FlutterwaveEventType;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

/**
 * Flutterwave's webhook hash is a shared static secret, so the charge, its metadata and its
 * amount are taken from the verify API rather than the delivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlutterwaveWebhookHandler implements ProviderWebhookHandler {

    private final WebhookPayloadReader payloadReader;
    private final TransactionReverifierRegistry reverifiers;
    private final VerifiedChargeAssembler chargeAssembler;
    private final SubscriptionReconciler subscriptionReconciler;
    private final BillingMetricsService metricsService;

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.FLUTTERWAVE;
    }

    @Override
    public Result handle(byte[] body, WebhookLoggingContext context) {
        FlutterwaveEvent event = payloadReader.read(body, FlutterwaveEvent.class);
        context.setEventId(event.id());
        context.setEventType(event.eventType());

        if (FlutterwaveEventType.from(event.eventType()) != FlutterwaveEventType.CHARGE_COMPLETED) {
            return Result.IGNORED;
        }

        FlutterwaveCharge charge = payloadReader.convert(event.data(), FlutterwaveCharge.class);
        context.setReference(charge.txRef());
        if (!charge.isSuccessful()) {
            context.logInfo(log, "Flutterwave charge completed with status {}", charge.status());
            return Result.IGNORED;
        }
        if (charge.id() == null || charge.id().isBlank() || charge.txRef() == null || charge.txRef().isBlank()) {
            throw new BillingValidationException("Missing transaction id or tx_ref");
        }

        VerifiedTransaction verified = reverifiers.require(PaymentProvider.FLUTTERWAVE).verify(charge.id(), charge.txRef());
        VerifiedCharge verifiedCharge = chargeAssembler.assemble(verified, ChargeMetadata.from(charge.meta()));
        context.setUserId(verifiedCharge.userId());

        ReconciliationResult result = subscriptionReconciler.reconcileSuccessfulCharge(verifiedCharge);
        context.setSubscriptionCode(result.subscriptionCode());
        metricsService.incrementReconciliation(PaymentProvider.FLUTTERWAVE, result.flow());
        return Result.PROCESSED;
    }
}
