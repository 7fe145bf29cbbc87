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
import uk.gegc.billingrecon.features.billing.domain.event.PaystackCharge;
import uk.gegc.billingrecon.features.billing.domain.event.PaystackEvent;
import uk.gegc.billingrecon.features.billing.domain.event.PaystackEventType;
import uk.gegc.billingrecon.features.billing.domain.event.PaystackSubscriptionData;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

/**
 * Paystack's signing key is the account secret key, so charges are re-fetched from the verify
 * API before anything is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaystackWebhookHandler implements ProviderWebhookHandler {

    private final WebhookPayloadReader payloadReader;
    private final TransactionReverifierRegistry reverifiers;
    private final VerifiedChargeAssembler chargeAssembler;
    private final SubscriptionReconciler subscriptionReconciler;
    private final BillingMetricsService metricsService;

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.PAYSTACK;
    }

    @Override
    public Result handle(byte[] body, WebhookLoggingContext context) {
        PaystackEvent event = payloadReader.read(body, PaystackEvent.class);
        context.setEventType(event.event());

        return switch (PaystackEventType.from(event.event())) {
            case CHARGE_SUCCESS -> handleChargeSuccess(payloadReader.convert(event.data(), PaystackCharge.class), context);
            case SUBSCRIPTION_CREATE -> {
                // activation happens on the paired charge.success
                context.logInfo(log, "Paystack subscription created");
                yield Result.PROCESSED;
            }
            case SUBSCRIPTION_DISABLE -> {
                subscriptionReconciler.cancel(subscriptionCode(event, context));
                yield Result.PROCESSED;
            }
            case SUBSCRIPTION_NOT_RENEW -> {
                subscriptionReconciler.markNonRenewing(subscriptionCode(event, context));
                yield Result.PROCESSED;
            }
            case INVOICE_FAILED, CHARGE_FAILED -> handlePaymentFailed(payloadReader.convert(event.data(), PaystackCharge.class), context);
            case UNKNOWN -> Result.IGNORED;
        };
    }

    private Result handleChargeSuccess(PaystackCharge charge, WebhookLoggingContext context) {
        String reference = charge.reference();
        if (reference == null || reference.isBlank()) {
            throw new BillingValidationException("Missing reference");
        }
        context.setReference(reference);

        ChargeMetadata eventMetadata = ChargeMetadata.from(charge.metadata());
        context.setUserId(eventMetadata.requireUserId());
        eventMetadata.requirePlan();

        VerifiedTransaction verified = reverifiers.require(PaymentProvider.PAYSTACK).verify(reference, reference);
        VerifiedCharge verifiedCharge = chargeAssembler.assemble(verified, eventMetadata);

        ReconciliationResult result = subscriptionReconciler.reconcileSuccessfulCharge(verifiedCharge);
        context.setSubscriptionCode(result.subscriptionCode());
        metricsService.incrementReconciliation(PaymentProvider.PAYSTACK, result.flow());
        return Result.PROCESSED;
    }

    private Result handlePaymentFailed(PaystackCharge charge, WebhookLoggingContext context) {
        context.setReference(charge.reference());
        String code = charge.explicitSubscriptionCode();
        if (code == null) {
            // one-off trial charges have no subscription to move
            context.logInfo(log, "Paystack payment failure without subscription code");
            return Result.IGNORED;
        }
        context.setSubscriptionCode(code);
        subscriptionReconciler.markPastDue(code);
        return Result.PROCESSED;
    }

    private String subscriptionCode(PaystackEvent event, WebhookLoggingContext context) {
        PaystackSubscriptionData data = payloadReader.convert(event.data(), PaystackSubscriptionData.class);
        if (data.subscriptionCode() == null || data.subscriptionCode().isBlank()) {
            throw new BillingValidationException("Missing subscription_code");
        }
        context.setSubscriptionCode(data.subscriptionCode());
        return data.subscriptionCode();
    }
}
