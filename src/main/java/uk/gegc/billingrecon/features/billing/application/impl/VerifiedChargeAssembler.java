package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.PlanPricing;
import uk.gegc.billingrecon.features.billing.application.VerifiedTransaction;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Turns a provider-verified transaction into a {@link VerifiedCharge}, shared by the webhook
 * handlers and checkout confirmation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerifiedChargeAssembler {

    static final String PREPAID_PLAN_PREFIX = "prepaid_";
    private static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.01");

    private final PlanPricing planPricing;

    /**
     * @param fallback metadata from the event itself, used for fields the verified transaction lacks
     */
    public VerifiedCharge assemble(VerifiedTransaction transaction, ChargeMetadata fallback) {
        ChargeMetadata metadata = (transaction.metadata() != null ? transaction.metadata() : ChargeMetadata.empty())
                .orElse(fallback);
        UUID userId = metadata.requireUserId();
        PlanTier plan = metadata.requirePlan();
        BillingInterval interval = metadata.interval();

        String recurringPlanCode = transaction.planCode();
        if (transaction.provider() == PaymentProvider.FLUTTERWAVE) {
            checkFlutterwaveAmount(transaction, plan, interval);
            if (recurringPlanCode == null && interval != BillingInterval.TRIAL) {
                // one payment for a full period of the plan
                recurringPlanCode = PREPAID_PLAN_PREFIX + interval.getCode();
            }
        }

        return VerifiedCharge.builder()
                .provider(transaction.provider())
                .reference(transaction.reference())
                .transactionId(transaction.transactionId())
                .userId(userId)
                .plan(plan)
                .interval(interval)
                .recurringPlanCode(recurringPlanCode)
                .subscriptionCode(transaction.subscriptionCode())
                .customerCode(transaction.customerCode())
                .authorizationCode(transaction.authorizationCode())
                .amount(transaction.amount())
                .currency(transaction.currency())
                .build();
    }

    private void checkFlutterwaveAmount(VerifiedTransaction transaction, PlanTier plan, BillingInterval interval) {
        CurrencyCode currency = CurrencyCode.fromCode(transaction.currency())
                .orElseThrow(() -> new WebhookAuthorizationException(
                        "Unsupported currency on verified transaction: " + transaction.currency()));
        BigDecimal expected = planPricing.priceFor(plan, interval, currency);
        BigDecimal actual = transaction.amount();
        if (actual == null || actual.subtract(expected).abs().compareTo(AMOUNT_TOLERANCE) > 0) {
            log.warn("Flutterwave amount mismatch for {}: expected {} {}, got {}",
                    transaction.reference(), expected, currency, actual);
            throw new WebhookAuthorizationException("Verified amount does not match the " + plan.getCode() + " price");
        }
    }
}
