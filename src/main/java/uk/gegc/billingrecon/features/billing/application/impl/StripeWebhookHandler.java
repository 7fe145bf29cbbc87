package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.BillingMetricsService;
import uk.gegc.billingrecon.features.billing.application.ProviderWebhookHandler;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.application.SubscriptionReconciler;
import uk.gegc.billingrecon.features.billing.application.WebhookEventRouter.Result;
import uk.gegc.billingrecon.features.billing.application.WebhookLoggingContext;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.event.StripeCheckoutSession;
import uk.gegc.billingrecon.features.billing.domain.event.StripeEventEnvelope;
import uk.gegc.billingrecon.features.billing.domain.event.StripeEventType;
import uk.gegc.billingrecon.features.billing.domain.event.StripeInvoiceObject;
import uk.gegc.billingrecon.features.billing.domain.event.StripeSubscriptionObject;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.util.Locale;
import java.util.UUID;

/**
 * Stripe deliveries are signed with a timestamp and carry the full object, so they are applied
 * without a second lookup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeWebhookHandler implements ProviderWebhookHandler {

    private final WebhookPayloadReader payloadReader;
    private final SubscriptionReconciler subscriptionReconciler;
    private final BillingMetricsService metricsService;

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.STRIPE;
    }

    @Override
    public Result handle(byte[] body, WebhookLoggingContext context) {
        StripeEventEnvelope event = payloadReader.read(body, StripeEventEnvelope.class);
        context.setEventId(event.id());
        context.setEventType(event.type());

        return switch (StripeEventType.from(event.type())) {
            case CHECKOUT_SESSION_COMPLETED ->
                    handleCheckoutCompleted(payloadReader.convert(event.object(), StripeCheckoutSession.class), context);
            case SUBSCRIPTION_CREATED -> {
                // activation happens on checkout.session.completed
                context.logInfo(log, "Stripe subscription created");
                yield Result.PROCESSED;
            }
            case SUBSCRIPTION_DELETED -> {
                String code = subscriptionId(payloadReader.convert(event.object(), StripeSubscriptionObject.class), context);
                subscriptionReconciler.cancel(code);
                yield Result.PROCESSED;
            }
            case SUBSCRIPTION_UPDATED ->
                    handleSubscriptionUpdated(payloadReader.convert(event.object(), StripeSubscriptionObject.class), context);
            case INVOICE_PAYMENT_FAILED -> {
                StripeInvoiceObject invoice = payloadReader.convert(event.object(), StripeInvoiceObject.class);
                String code = invoice.subscriptionId();
                if (code == null) {
                    yield Result.IGNORED;
                }
                context.setSubscriptionCode(code);
                subscriptionReconciler.markPastDue(code);
                yield Result.PROCESSED;
            }
            case UNKNOWN -> Result.IGNORED;
        };
    }

    private Result handleCheckoutCompleted(StripeCheckoutSession session, WebhookLoggingContext context) {
        context.setReference(session.paymentReference());
        if (!session.isPaid()) {
            context.logInfo(log, "Stripe checkout {} completed without payment yet", session.id());
            return Result.IGNORED;
        }

        ChargeMetadata metadata = ChargeMetadata.from(session.metadata());
        UUID userId = metadata.requireUserId();
        PlanTier plan = metadata.requirePlan();
        context.setUserId(userId);

        VerifiedCharge charge = VerifiedCharge.builder()
                .provider(PaymentProvider.STRIPE)
                .reference(session.paymentReference())
                .transactionId(session.id())
                .userId(userId)
                .plan(plan)
                .interval(metadata.interval())
                .recurringPlanCode(session.subscriptionId())
                .subscriptionCode(session.subscriptionId())
                .customerCode(session.customerId())
                .amount(session.amount())
                .currency(session.currency() != null ? session.currency().toUpperCase(Locale.ROOT) : null)
                .build();

        ReconciliationResult result = subscriptionReconciler.reconcileSuccessfulCharge(charge);
        context.setSubscriptionCode(result.subscriptionCode());
        metricsService.incrementReconciliation(PaymentProvider.STRIPE, result.flow());
        return Result.PROCESSED;
    }

    private Result handleSubscriptionUpdated(StripeSubscriptionObject subscription, WebhookLoggingContext context) {
        String code = subscriptionId(subscription, context);
        if (subscription.cancelAtPeriodEnd()) {
            subscriptionReconciler.markNonRenewing(code);
            return Result.PROCESSED;
        }
        if (subscription.isDelinquent()) {
            subscriptionReconciler.markPastDue(code);
            return Result.PROCESSED;
        }
        return Result.IGNORED;
    }

    private String subscriptionId(StripeSubscriptionObject subscription, WebhookLoggingContext context) {
        if (subscription.id() == null || subscription.id().isBlank()) {
            throw new BillingValidationException("Missing subscription id");
        }
        context.setSubscriptionCode(subscription.id());
        return subscription.id();
    }
}
