package uk.gegc.billingrecon.features.billing.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A successful charge that passed signature verification (and re-verification where the
 * provider requires it), normalized across providers.
 *
 * @param recurringPlanCode provider plan identifier when the charge belongs to a recurring plan,
 *                          otherwise {@code null}
 * @param subscriptionCode  explicit provider subscription code, if the provider sent one
 */
@Builder
public record VerifiedCharge(
        PaymentProvider provider,
        String reference,
        String transactionId,
        UUID userId,
        PlanTier plan,
        BillingInterval interval,
        String recurringPlanCode,
        String subscriptionCode,
        String customerCode,
        String authorizationCode,
        BigDecimal amount,
        String currency
) {

    public boolean hasRecurringPlan() {
        return recurringPlanCode != null && !recurringPlanCode.isBlank();
    }
}
